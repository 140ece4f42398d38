package com.example.docaudit.infrastructure.text;

import com.example.docaudit.config.DocAuditProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Decodes uploaded plain-text files. UTF-8 is tried first; when it yields replacement characters
 * the bytes are decoded again with the configured single-byte charset.
 */
@Component
public class PlainTextDecoder {

    private static final Logger log = LoggerFactory.getLogger(PlainTextDecoder.class);
    private static final char REPLACEMENT_CHARACTER = '\uFFFD';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Charset fallbackCharset;

    public PlainTextDecoder(DocAuditProperties properties) {
        this.fallbackCharset = properties.fallbackCharset();
    }

    /**
     * @param content raw bytes, {@code null} is treated as empty
     * @return decoded text
     */
    public String decode(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        String utf8 = new String(content, StandardCharsets.UTF_8);
        if (utf8.indexOf(REPLACEMENT_CHARACTER) < 0) {
            return stripByteOrderMark(utf8);
        }
        log.debug("Text upload is not valid UTF-8, decoding as {}", fallbackCharset.name());
        return new String(content, fallbackCharset);
    }

    private String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }
}
