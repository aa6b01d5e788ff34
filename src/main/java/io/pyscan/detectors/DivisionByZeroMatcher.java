package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.syntax.Expr;
import io.pyscan.syntax.Node;

import java.util.Optional;

/**
 * Flags {@code /}, {@code //} and {@code %} with a literal zero divisor.
 * Only int and float literals count; {@code x / False} and {@code x / 0j} are not flagged.
 */
public class DivisionByZeroMatcher implements PatternMatcher {

    static final String EXPLANATION = "This expression can divide by zero.";

    @Override
    public String name() {
        return "division-by-zero";
    }

    @Override
    public Optional<Finding> match(Node node, AnalysisContext context) {
        if (!(node instanceof Expr.BinOp binOp) || !binOp.op().isDivision()) {
            return Optional.empty();
        }
        if (!(binOp.right() instanceof Expr.Constant divisor) || !divisor.isNumericZero()) {
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .kind(FindingKind.DIVISION_BY_ZERO)
                .line(binOp.line())
                .snippet(context.source().snippet(binOp.span()))
                .explanation(EXPLANATION)
                .detectorId(RuntimePatternDetector.ID)
                .build());
    }
}
