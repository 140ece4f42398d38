package com.example.docaudit.infrastructure.exception;

/**
 * Raised when the bytes of an uploaded multipart file cannot be read.
 */
public class DocumentReadException extends InfrastructureException {

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
