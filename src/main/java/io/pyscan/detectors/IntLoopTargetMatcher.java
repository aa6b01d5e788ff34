package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.syntax.Expr;
import io.pyscan.syntax.Node;
import io.pyscan.syntax.Stmt;

import java.util.Optional;

/**
 * Flags {@code for} loops over an integer literal, as in {@code for i in 5:}.
 * The finding points at the literal, not the loop header.
 */
public class IntLoopTargetMatcher implements PatternMatcher {

    static final String EXPLANATION = "You are trying to iterate over an int, which is not iterable.";

    @Override
    public String name() {
        return "int-loop-target";
    }

    @Override
    public Optional<Finding> match(Node node, AnalysisContext context) {
        if (!(node instanceof Stmt.For loop)) {
            return Optional.empty();
        }
        if (!(loop.iter() instanceof Expr.Constant constant) || !constant.isInteger()) {
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .kind(FindingKind.NON_ITERABLE_LOOP_TARGET)
                .line(constant.line())
                .snippet(context.source().snippet(constant.span()))
                .explanation(EXPLANATION)
                .detectorId(RuntimePatternDetector.ID)
                .build());
    }
}
