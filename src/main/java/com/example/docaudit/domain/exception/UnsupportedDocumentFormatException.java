package com.example.docaudit.domain.exception;

/**
 * Raised when the uploaded file extension is not one the service can turn into text.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Unsupported format, use .docx, .pdf, .xlsx or .txt" + (fileName != null ? ": " + fileName : "."));
    }
}
