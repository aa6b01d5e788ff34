package io.pyscan.detectors;

import io.pyscan.model.Finding;

import java.util.List;

/**
 * Base interface for all issue detectors.
 * Each detector walks the syntax tree looking for one family of problems.
 * <p>
 * Implementations keep no state between calls to {@link #detect(AnalysisContext)}.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Detects issues in the given tree.
     *
     * @param context Parsed tree, its source and the builtin name table
     * @return Findings in tree traversal order
     */
    List<Finding> detect(AnalysisContext context);

    /**
     * Returns true if this detector is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }
}
