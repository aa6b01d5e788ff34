package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.scope.ScopeStack;
import io.pyscan.syntax.Expr;
import io.pyscan.syntax.Module;
import io.pyscan.syntax.Parameter;
import io.pyscan.syntax.Stmt;
import io.pyscan.syntax.TreeScanner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects reads of names that are not visible in any enclosing lexical scope.
 * <p>
 * Single pass in source order: a name counts as defined from the point its binding is walked,
 * so a use that precedes every binding is reported. Binding rules:
 * <ul>
 *   <li>function and class names are defined in the enclosing frame before their bodies are walked,
 *       so recursion and later sibling calls resolve</li>
 *   <li>decorators, defaults, annotations and base classes are read in the enclosing frame</li>
 *   <li>parameters, exception handler names, lambda and comprehension targets live in a new frame</li>
 *   <li>assignment, loop, {@code with} targets and {@code case} captures are defined in the current frame</li>
 *   <li>an assignment expression binds in the nearest frame that is not a comprehension</li>
 *   <li>wildcard imports bind nothing</li>
 * </ul>
 * Each (name, line) pair is reported at most once.
 */
public class UndefinedNameDetector implements Detector {

    public static final String ID = "undefined-name";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Detects variables that might be used before they are defined";
    }

    @Override
    public List<Finding> detect(AnalysisContext context) {
        Walker walker = new Walker(context);
        walker.scan(context.tree(), ScopeStack.global());
        return walker.findings;
    }

    static String explanationFor(String name) {
        return "Variable '" + name + "' might not be defined before it is used.";
    }

    private static final class Walker extends TreeScanner<ScopeStack> {

        private final AnalysisContext context;
        private final List<Finding> findings = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        private Walker(AnalysisContext context) {
            this.context = context;
        }

        @Override
        public Void visitModule(Module node, ScopeStack scope) {
            scan(node.body(), scope);
            return null;
        }

        @Override
        public Void visitName(Expr.Name node, ScopeStack scope) {
            String name = node.id();
            if (context.builtins().isBuiltin(name) || scope.isVisible(name)) {
                return null;
            }
            if (!seen.add(name + "@" + node.line())) {
                return null;
            }
            findings.add(Finding.builder()
                    .kind(FindingKind.UNDEFINED_REFERENCE)
                    .line(node.line())
                    .snippet(context.source().snippet(node.span()))
                    .explanation(explanationFor(name))
                    .detectorId(ID)
                    .build());
            return null;
        }

        // ---- definitions ----

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node, ScopeStack scope) {
            scope.define(node.name());
            scan(node.decorators(), scope);
            scanParameters(node.params(), scope);
            scan(node.returns(), scope);

            ScopeStack body = scope.push();
            defineParameters(node.params(), body);
            scan(node.body(), body);
            return null;
        }

        @Override
        public Void visitClassDef(Stmt.ClassDef node, ScopeStack scope) {
            scope.define(node.name());
            scan(node.decorators(), scope);
            scan(node.bases(), scope);
            scanKeywords(node.keywords(), scope);
            scan(node.body(), scope.push());
            return null;
        }

        @Override
        public Void visitLambda(Expr.Lambda node, ScopeStack scope) {
            scanParameters(node.params(), scope);
            ScopeStack body = scope.push();
            defineParameters(node.params(), body);
            scan(node.body(), body);
            return null;
        }

        @Override
        public Void visitImport(Stmt.Import node, ScopeStack scope) {
            for (Stmt.Alias alias : node.names()) {
                scope.define(alias.boundByImport());
            }
            return null;
        }

        @Override
        public Void visitImportFrom(Stmt.ImportFrom node, ScopeStack scope) {
            if (node.wildcard()) {
                return null;
            }
            for (Stmt.Alias alias : node.names()) {
                scope.define(alias.boundByFromImport());
            }
            return null;
        }

        // ---- bindings ----

        @Override
        public Void visitAssign(Stmt.Assign node, ScopeStack scope) {
            for (Expr target : node.targets()) {
                defineTarget(target, scope);
            }
            for (Expr target : node.targets()) {
                scanTargetReads(target, scope);
            }
            scan(node.value(), scope);
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node, ScopeStack scope) {
            defineTarget(node.target(), scope);
            scanTargetReads(node.target(), scope);
            scan(node.value(), scope);
            return null;
        }

        @Override
        public Void visitAnnAssign(Stmt.AnnAssign node, ScopeStack scope) {
            defineTarget(node.target(), scope);
            scanTargetReads(node.target(), scope);
            scan(node.annotation(), scope);
            scan(node.value(), scope);
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node, ScopeStack scope) {
            scan(node.iter(), scope);
            defineTarget(node.target(), scope);
            scanTargetReads(node.target(), scope);
            scan(node.body(), scope);
            scan(node.orElse(), scope);
            return null;
        }

        @Override
        public Void visitWith(Stmt.With node, ScopeStack scope) {
            for (Stmt.WithItem item : node.items()) {
                scan(item.context(), scope);
                if (item.target() != null) {
                    defineTarget(item.target(), scope);
                    scanTargetReads(item.target(), scope);
                }
            }
            scan(node.body(), scope);
            return null;
        }

        @Override
        public Void visitTry(Stmt.Try node, ScopeStack scope) {
            scan(node.body(), scope);
            for (Stmt.ExceptHandler handler : node.handlers()) {
                scan(handler.type(), scope);
                ScopeStack handlerScope = scope.push();
                handlerScope.define(handler.name());
                scan(handler.body(), handlerScope);
            }
            scan(node.orElse(), scope);
            scan(node.finalBody(), scope);
            return null;
        }

        @Override
        public Void visitMatch(Stmt.Match node, ScopeStack scope) {
            scan(node.subject(), scope);
            for (Stmt.MatchCase matchCase : node.cases()) {
                scan(matchCase.reads(), scope);
                for (Expr.Name capture : matchCase.captures()) {
                    scope.define(capture.id());
                }
                scan(matchCase.guard(), scope);
                scan(matchCase.body(), scope);
            }
            return null;
        }

        @Override
        public Void visitDelete(Stmt.Delete node, ScopeStack scope) {
            for (Expr target : node.targets()) {
                scanTargetReads(target, scope);
            }
            return null;
        }

        @Override
        public Void visitNamedExpr(Expr.NamedExpr node, ScopeStack scope) {
            scan(node.value(), scope);
            scope.bindingFrame().define(node.target().id());
            return null;
        }

        @Override
        public Void visitComprehension(Expr.Comprehension node, ScopeStack scope) {
            ScopeStack inner = scanGenerators(node.generators(), scope);
            scan(node.element(), inner);
            return null;
        }

        @Override
        public Void visitDictComprehension(Expr.DictComprehension node, ScopeStack scope) {
            ScopeStack inner = scanGenerators(node.generators(), scope);
            scan(node.key(), inner);
            scan(node.value(), inner);
            return null;
        }

        /**
         * The first iterable is evaluated in the enclosing scope; everything else runs in the
         * comprehension's own frame.
         */
        private ScopeStack scanGenerators(List<Expr.Generator> generators, ScopeStack scope) {
            ScopeStack inner = scope.pushComprehension();
            boolean first = true;
            for (Expr.Generator generator : generators) {
                scan(generator.iter(), first ? scope : inner);
                first = false;
                defineTarget(generator.target(), inner);
                scanTargetReads(generator.target(), inner);
                scan(generator.ifs(), inner);
            }
            return inner;
        }

        private void defineParameters(List<Parameter> params, ScopeStack scope) {
            for (Parameter parameter : params) {
                scope.define(parameter.name());
            }
        }

        private void defineTarget(Expr target, ScopeStack scope) {
            if (target instanceof Expr.Name name) {
                scope.define(name.id());
            } else if (target instanceof Expr.Sequence sequence) {
                for (Expr element : sequence.elements()) {
                    defineTarget(element, scope);
                }
            } else if (target instanceof Expr.Starred starred) {
                defineTarget(starred.value(), scope);
            }
        }

        /**
         * Walks the parts of a binding target that are read, e.g. {@code obj} in {@code obj.attr = 1}.
         */
        private void scanTargetReads(Expr target, ScopeStack scope) {
            if (target instanceof Expr.Attribute attribute) {
                scan(attribute.value(), scope);
            } else if (target instanceof Expr.Subscript subscript) {
                scan(subscript.value(), scope);
                scan(subscript.slice(), scope);
            } else if (target instanceof Expr.Sequence sequence) {
                for (Expr element : sequence.elements()) {
                    scanTargetReads(element, scope);
                }
            } else if (target instanceof Expr.Starred starred) {
                scanTargetReads(starred.value(), scope);
            }
        }
    }
}
