package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.syntax.Node;
import io.pyscan.syntax.TreeScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects common runtime pitfalls: literal zero divisors, loops over an int literal
 * and equality comparisons against None.
 * <p>
 * One pre-order traversal offers every node to every matcher, so findings come out in tree order.
 */
public class RuntimePatternDetector implements Detector {

    public static final String ID = "runtime-patterns";

    private final List<PatternMatcher> matchers;

    public RuntimePatternDetector() {
        this(List.of(
                new DivisionByZeroMatcher(),
                new IntLoopTargetMatcher(),
                new NoneComparisonMatcher()
        ));
    }

    public RuntimePatternDetector(List<PatternMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Detects division by zero, loops over integers and == None comparisons";
    }

    @Override
    public List<Finding> detect(AnalysisContext context) {
        List<Finding> findings = new ArrayList<>();
        new TreeScanner<Void>() {
            @Override
            public void scan(Node node, Void param) {
                if (node == null) {
                    return;
                }
                for (PatternMatcher matcher : matchers) {
                    matcher.match(node, context).ifPresent(findings::add);
                }
                super.scan(node, param);
            }
        }.scan(context.tree(), null);
        return findings;
    }

    public List<PatternMatcher> matchers() {
        return matchers;
    }
}
