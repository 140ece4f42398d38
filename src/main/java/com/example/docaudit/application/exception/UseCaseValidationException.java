package com.example.docaudit.application.exception;

/**
 * Signals validation issues detected while running an application layer use case.
 * The API layer translates this exception into an HTTP 400 response.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the caller.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }

    protected UseCaseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
