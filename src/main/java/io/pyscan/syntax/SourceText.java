package io.pyscan.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Source text together with its UTF-8 bytes.
 * Tree-sitter reports UTF-8 byte offsets, so snippets are cut from the byte array, not from the String.
 */
public final class SourceText {

    private static final Logger log = LoggerFactory.getLogger(SourceText.class);

    private final String text;
    private final byte[] utf8Bytes;
    private final List<String> lines;

    private SourceText(String text) {
        this.text = text;
        this.utf8Bytes = text.getBytes(StandardCharsets.UTF_8);
        this.lines = splitLines(text);
    }

    public static SourceText of(String text) {
        return new SourceText(text == null ? "" : text);
    }

    private static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                result.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        result.add(text.substring(start));
        return List.copyOf(result);
    }

    /**
     * Extracts the text between two UTF-8 byte offsets [startByte, endByte).
     * Out-of-range requests are clamped; an unusable range yields the empty string.
     */
    public String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            log.warn("Byte range [{}, {}) outside source of {} bytes", startByte, endByte, utf8Bytes.length);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    /**
     * Returns the exact source text covered by a node.
     */
    public String snippet(Span span) {
        return slice(span.startByte(), span.endByte());
    }

    /**
     * Returns the text of a 1-based line without its terminator, or the empty string if out of range.
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    public int lineCount() {
        return lines.size();
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }
}
