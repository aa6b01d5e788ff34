package io.pyscan.analysis;

/**
 * Thrown when source text exceeds the configured character limit.
 */
public class InputTooLargeException extends RuntimeException {

    private final int length;
    private final int limit;

    public InputTooLargeException(int length, int limit) {
        super("Code is too large (" + length + " characters). Max is " + limit + " characters.");
        this.length = length;
        this.limit = limit;
    }

    public int length() {
        return length;
    }

    public int limit() {
        return limit;
    }
}
