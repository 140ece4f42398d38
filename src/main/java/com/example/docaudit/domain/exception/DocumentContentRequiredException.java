package com.example.docaudit.domain.exception;

/**
 * Raised when a request reaches a use case without any document content.
 */
public class DocumentContentRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentContentRequiredException() {
        super("Missing document content.");
    }
}
