package io.pyscan.model;

import java.util.Optional;

/**
 * A single issue or nudge reported by a detector.
 *
 * @param kind        Category of the issue
 * @param line        1-based source line, or null if the issue cannot be localized
 * @param snippet     Exact source text of the offending node, or null if unavailable
 * @param explanation Beginner-oriented rationale
 * @param severity    Severity of the finding (defaults to the kind's severity)
 * @param detectorId  ID of the detector that produced this finding ("parser" for syntax errors)
 */
public record Finding(
        FindingKind kind,
        Integer line,
        String snippet,
        String explanation,
        Severity severity,
        String detectorId
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (explanation == null || explanation.isBlank()) {
            throw new IllegalArgumentException("explanation cannot be null or blank");
        }
        if (line != null && line < 1) {
            throw new IllegalArgumentException("line must be 1-based, got " + line);
        }
        if (severity == null) {
            severity = kind.defaultSeverity();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FindingKind kind;
        private Integer line;
        private String snippet;
        private String explanation;
        private Severity severity;
        private String detectorId;

        public Builder kind(FindingKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder snippet(String snippet) {
            this.snippet = snippet;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder detectorId(String detectorId) {
            this.detectorId = detectorId;
            return this;
        }

        public Finding build() {
            return new Finding(kind, line, snippet, explanation, severity, detectorId);
        }
    }

    /**
     * Returns the short issue type shown to learners, e.g. "ZeroDivisionError".
     */
    public String label() {
        return kind.label();
    }

    public Optional<Integer> lineNumber() {
        return Optional.ofNullable(line);
    }

    public Optional<String> snippetText() {
        return Optional.ofNullable(snippet);
    }

    /**
     * Returns a display-friendly location string.
     */
    public String location() {
        return line != null ? "line " + line : "unknown line";
    }
}
