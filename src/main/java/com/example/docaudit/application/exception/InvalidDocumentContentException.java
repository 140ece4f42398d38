package com.example.docaudit.application.exception;

/**
 * Thrown when the base64 payload of a JSON request cannot be decoded.
 */
public class InvalidDocumentContentException extends UseCaseValidationException {

    public InvalidDocumentContentException(Throwable cause) {
        super("ContentBase64 is not valid base64.", cause);
    }
}
