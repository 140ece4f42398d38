package com.example.docaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Typed view of the {@code docaudit.*} properties.
 *
 * @param fallbackCharset      single-byte charset used when a text upload is not valid UTF-8
 * @param pdfSortByPosition    whether PDF text is re-ordered by page position before line splitting
 */
@ConfigurationProperties(prefix = "docaudit")
public record DocAuditProperties(
        Charset fallbackCharset,
        Boolean pdfSortByPosition
) {
    public DocAuditProperties {
        if (fallbackCharset == null) {
            fallbackCharset = StandardCharsets.ISO_8859_1;
        }
        if (pdfSortByPosition == null) {
            pdfSortByPosition = Boolean.TRUE;
        }
    }

    public static DocAuditProperties defaults() {
        return new DocAuditProperties(null, null);
    }
}
