package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.syntax.Expr;
import io.pyscan.syntax.Node;

import java.util.Optional;

/**
 * Nudges {@code x == None} and {@code x != None} towards {@code is None}.
 * Chained comparisons are left alone.
 */
public class NoneComparisonMatcher implements PatternMatcher {

    static final String EXPLANATION = "Use `is None` / `is not None` for None checks.";

    @Override
    public String name() {
        return "none-comparison";
    }

    @Override
    public Optional<Finding> match(Node node, AnalysisContext context) {
        if (!(node instanceof Expr.Compare compare) || compare.ops().size() != 1) {
            return Optional.empty();
        }
        if (!compare.ops().get(0).isEquality()) {
            return Optional.empty();
        }
        if (!isNone(compare.left()) && !isNone(compare.comparators().get(0))) {
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .kind(FindingKind.IDENTITY_VS_EQUALITY_STYLE)
                .line(compare.line())
                .snippet(context.source().snippet(compare.span()))
                .explanation(EXPLANATION)
                .detectorId(RuntimePatternDetector.ID)
                .build());
    }

    private static boolean isNone(Expr expr) {
        return expr instanceof Expr.Constant constant && constant.isNone();
    }
}
