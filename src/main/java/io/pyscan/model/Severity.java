package io.pyscan.model;

import java.util.Locale;

/**
 * Severity of a finding.
 * Errors stop the program from running, warnings are likely bugs, info entries are style nudges.
 */
public enum Severity {
    ERROR(1, "error"),
    WARNING(2, "warning"),
    INFO(3, "info");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a lower- or upper-case severity label.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            case "info" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
