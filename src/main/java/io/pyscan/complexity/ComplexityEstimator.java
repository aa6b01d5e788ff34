package io.pyscan.complexity;

import io.pyscan.model.ComplexityProfile;
import io.pyscan.syntax.Expr;
import io.pyscan.syntax.Module;
import io.pyscan.syntax.Stmt;
import io.pyscan.syntax.TreeScanner;

/**
 * Derives coarse time and space labels from loop nesting and direct recursion.
 * <p>
 * Loop depth is lexical across the whole file: a loop inside a function defined inside a loop
 * counts as nested. Recursion is a file-wide flag set by any function whose body calls its own
 * name directly.
 */
public class ComplexityEstimator {

    public static final String TIME_RECURSIVE = "Depends on recursion depth; often O(2^n) for naive recursion";
    public static final String TIME_LINEAR = "Roughly O(n)";
    public static final String TIME_QUADRATIC = "Approximately O(n^2)";
    public static final String TIME_POLYNOMIAL = "Approximately O(n^k), k > 2";
    public static final String SPACE_RECURSIVE = "O(recursion depth)";
    public static final String SPACE_TYPICAL = "O(1) to O(n) typical for this file";

    public ComplexityProfile estimate(Module tree) {
        LoopWalker walker = new LoopWalker();
        walker.scan(tree, null);
        return classify(walker.maxDepth, walker.recursive);
    }

    public static ComplexityProfile classify(int maxLoopDepth, boolean recursive) {
        if (recursive) {
            return new ComplexityProfile(TIME_RECURSIVE, SPACE_RECURSIVE, maxLoopDepth, true);
        }
        String time = switch (maxLoopDepth) {
            case 0, 1 -> TIME_LINEAR;
            case 2 -> TIME_QUADRATIC;
            default -> TIME_POLYNOMIAL;
        };
        return new ComplexityProfile(time, SPACE_TYPICAL, maxLoopDepth, false);
    }

    private static final class LoopWalker extends TreeScanner<Void> {

        private int depth;
        private int maxDepth;
        private boolean recursive;

        @Override
        public Void visitFor(Stmt.For node, Void param) {
            enterLoop();
            super.visitFor(node, param);
            depth--;
            return null;
        }

        @Override
        public Void visitWhile(Stmt.While node, Void param) {
            enterLoop();
            super.visitWhile(node, param);
            depth--;
            return null;
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node, Void param) {
            if (!recursive) {
                SelfCallFinder finder = new SelfCallFinder(node.name());
                finder.scan(node, null);
                recursive = finder.found;
            }
            return super.visitFunctionDef(node, param);
        }

        private void enterLoop() {
            depth++;
            maxDepth = Math.max(maxDepth, depth);
        }
    }

    /**
     * Looks for {@code name(...)} anywhere under a function, nested definitions included.
     */
    private static final class SelfCallFinder extends TreeScanner<Void> {

        private final String name;
        private boolean found;

        private SelfCallFinder(String name) {
            this.name = name;
        }

        @Override
        public Void visitCall(Expr.Call node, Void param) {
            if (node.func() instanceof Expr.Name callee && callee.id().equals(name)) {
                found = true;
                return null;
            }
            return super.visitCall(node, param);
        }
    }
}
