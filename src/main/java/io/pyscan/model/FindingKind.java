package io.pyscan.model;

/**
 * Fixed vocabulary of issues the analyzer can report.
 * The label is the short issue type shown to learners.
 */
public enum FindingKind {
    /**
     * A name is read that is neither visible in any enclosing scope nor a builtin.
     */
    UNDEFINED_REFERENCE("Potential issue", Severity.WARNING),

    /**
     * Division, floor division or modulo by a literal zero.
     */
    DIVISION_BY_ZERO("ZeroDivisionError", Severity.WARNING),

    /**
     * A for loop iterating directly over an integer literal.
     */
    NON_ITERABLE_LOOP_TARGET("TypeError", Severity.WARNING),

    /**
     * Equality comparison against None where an identity check is idiomatic.
     */
    IDENTITY_VS_EQUALITY_STYLE("BestPractice", Severity.INFO),

    /**
     * The source could not be parsed.
     */
    SYNTAX_ERROR("SyntaxError", Severity.ERROR);

    private final String label;
    private final Severity defaultSeverity;

    FindingKind(String label, Severity defaultSeverity) {
        this.label = label;
        this.defaultSeverity = defaultSeverity;
    }

    public String label() {
        return label;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
