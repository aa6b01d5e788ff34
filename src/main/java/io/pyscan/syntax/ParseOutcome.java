package io.pyscan.syntax;

import java.util.Optional;

/**
 * Result of parsing source text: either a tree or a structured failure.
 */
public sealed interface ParseOutcome {

    /**
     * A successfully parsed tree with the source it came from.
     */
    record Parsed(Module tree, SourceText source) implements ParseOutcome {
    }

    /**
     * The source could not be parsed.
     *
     * @param line          1-based line of the first problem, or null if unknown
     * @param message       Parser message, e.g. "invalid syntax"
     * @param offendingText The trimmed source line, or null if blank or unknown
     */
    record Failure(Integer line, String message, String offendingText) implements ParseOutcome {
        public Failure {
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }

        public Optional<String> offendingTextIfAny() {
            return Optional.ofNullable(offendingText);
        }
    }
}
