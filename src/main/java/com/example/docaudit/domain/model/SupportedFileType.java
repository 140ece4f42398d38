package com.example.docaudit.domain.model;

import java.util.Locale;

/**
 * File formats the service can turn into text.
 * PDFs go through the PDF text layer, Office documents through POI, plain text through the
 * charset-aware decoder.
 */
public enum SupportedFileType {
    PDF(".pdf"),
    DOCX(".docx"),
    XLSX(".xlsx"),
    TXT(".txt");

    private final String extension;

    SupportedFileType(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

	/**
	 * Resolves the file type from a file name's extension.
	 *
	 * @param fileName original file name supplied by the client
	 * @return matching type or {@code null} when the extension is missing or unsupported
	 */
    public static SupportedFileType fromFileName(String fileName) {
        String extension = extensionOf(fileName);
        if (extension == null) {
            return null;
        }
        for (SupportedFileType type : values()) {
            if (type.extension.equals(extension)) {
                return type;
            }
        }
        return null;
    }

	/**
	 * Extracts the lowercase extension including the leading dot.
	 *
	 * @param fileName file name, possibly {@code null}
	 * @return extension such as {@code ".pdf"} or {@code null}
	 */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return null;
        }
        String trimmed = fileName.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot < 0 || dot == trimmed.length() - 1) {
            return null;
        }
        return trimmed.substring(dot).toLowerCase(Locale.ROOT);
    }
}
