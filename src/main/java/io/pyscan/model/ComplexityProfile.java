package io.pyscan.model;

/**
 * Coarse, qualitative time/space classification of a source file.
 * The labels are buckets derived from loop nesting and recursion, not measured bounds.
 *
 * @param timeClass    Qualitative time complexity label
 * @param spaceClass   Qualitative space complexity label
 * @param maxLoopDepth Deepest lexical loop nesting seen anywhere in the file
 * @param recursive    True if any function calls itself by name
 */
public record ComplexityProfile(
        String timeClass,
        String spaceClass,
        int maxLoopDepth,
        boolean recursive
) {
    public ComplexityProfile {
        if (timeClass == null || timeClass.isBlank()) {
            throw new IllegalArgumentException("timeClass cannot be null or blank");
        }
        if (spaceClass == null || spaceClass.isBlank()) {
            throw new IllegalArgumentException("spaceClass cannot be null or blank");
        }
        if (maxLoopDepth < 0) {
            throw new IllegalArgumentException("maxLoopDepth cannot be negative");
        }
    }
}
