package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.syntax.Node;

import java.util.Optional;

/**
 * Checks a single node for one suspicious shape.
 * Matchers look at the node alone and never at its ancestors.
 */
public interface PatternMatcher {

    /**
     * Returns a short identifier, used in logs.
     */
    String name();

    Optional<Finding> match(Node node, AnalysisContext context);
}
