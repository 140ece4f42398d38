package com.example.docaudit.application.exception;

/**
 * Thrown by the personal-data use case, which needs the file name to pick a text extractor.
 */
public class FileNameRequiredException extends UseCaseValidationException {

    public FileNameRequiredException() {
        super("FileName and ContentBase64 are required.");
    }
}
