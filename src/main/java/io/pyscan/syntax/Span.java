package io.pyscan.syntax;

/**
 * Location of a syntax node in the source text.
 *
 * @param line      1-based line the node starts on
 * @param startByte UTF-8 byte offset of the first byte of the node
 * @param endByte   UTF-8 byte offset one past the last byte of the node
 */
public record Span(int line, int startByte, int endByte) {
    public Span {
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1-based, got " + line);
        }
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("invalid byte range [" + startByte + ", " + endByte + ")");
        }
    }
}
