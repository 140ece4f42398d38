package com.example.docaudit.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals the document text could not be extracted.
 */
public class TextExtractionException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
