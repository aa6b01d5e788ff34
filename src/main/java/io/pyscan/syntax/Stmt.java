package io.pyscan.syntax;

import java.util.List;

/**
 * Statement variants.
 */
public sealed interface Stmt extends Node {

    /**
     * {@code def} or {@code async def}. Decorators and the defaults/annotations inside
     * {@code params} belong to the enclosing scope; the body gets a new one.
     */
    record FunctionDef(
            String name,
            List<Parameter> params,
            List<Expr> decorators,
            Expr returns,
            List<Stmt> body,
            boolean async,
            Span span
    ) implements Stmt {
        public FunctionDef {
            params = List.copyOf(params);
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFunctionDef(this, param);
        }
    }

    record ClassDef(
            String name,
            List<Expr> bases,
            List<Expr.Keyword> keywords,
            List<Expr> decorators,
            List<Stmt> body,
            Span span
    ) implements Stmt {
        public ClassDef {
            bases = List.copyOf(bases);
            keywords = List.copyOf(keywords);
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitClassDef(this, param);
        }
    }

    record Return(Expr value, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitReturn(this, param);
        }
    }

    record Delete(List<Expr> targets, Span span) implements Stmt {
        public Delete {
            targets = List.copyOf(targets);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDelete(this, param);
        }
    }

    /**
     * {@code a = b = value}; chained targets are listed left to right.
     */
    record Assign(List<Expr> targets, Expr value, Span span) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAssign(this, param);
        }
    }

    record AugAssign(Expr target, Expr.BinOp.Op op, Expr value, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAugAssign(this, param);
        }
    }

    /**
     * {@code target: annotation [= value]}; value may be null.
     */
    record AnnAssign(Expr target, Expr annotation, Expr value, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAnnAssign(this, param);
        }
    }

    record For(
            Expr target,
            Expr iter,
            List<Stmt> body,
            List<Stmt> orElse,
            boolean async,
            Span span
    ) implements Stmt {
        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFor(this, param);
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, Span span) implements Stmt {
        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWhile(this, param);
        }
    }

    /**
     * {@code if}; an {@code elif} chain is a nested If as the only statement of {@code orElse}.
     */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, Span span) implements Stmt {
        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIf(this, param);
        }
    }

    record With(List<WithItem> items, List<Stmt> body, boolean async, Span span) implements Stmt {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWith(this, param);
        }
    }

    /**
     * One {@code context [as target]} item; target may be null.
     */
    record WithItem(Expr context, Expr target) {
    }

    record Try(
            List<Stmt> body,
            List<ExceptHandler> handlers,
            List<Stmt> orElse,
            List<Stmt> finalBody,
            Span span
    ) implements Stmt {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitTry(this, param);
        }
    }

    /**
     * {@code except [type [as name]]:}; type and name may be null.
     */
    record ExceptHandler(Expr type, String name, List<Stmt> body, Span span) {
        public ExceptHandler {
            body = List.copyOf(body);
        }
    }

    /**
     * {@code match subject:} with its {@code case} clauses in source order.
     */
    record Match(Expr subject, List<MatchCase> cases, Span span) implements Stmt {
        public Match {
            cases = List.copyOf(cases);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitMatch(this, param);
        }
    }

    /**
     * One {@code case pattern [if guard]:} clause.
     * <p>
     * The pattern is flattened into the expressions it reads (value patterns such as
     * {@code Color.RED}, class names in class patterns) and the names it captures.
     * The guard may be null.
     */
    record MatchCase(List<Expr> reads, List<Expr.Name> captures, Expr guard, List<Stmt> body, Span span) {
        public MatchCase {
            reads = List.copyOf(reads);
            captures = List.copyOf(captures);
            body = List.copyOf(body);
        }
    }

    record Raise(Expr exception, Expr cause, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRaise(this, param);
        }
    }

    record Assert(Expr test, Expr message, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAssert(this, param);
        }
    }

    record Import(List<Alias> names, Span span) implements Stmt {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitImport(this, param);
        }
    }

    /**
     * {@code from module import names}. A wildcard import has no names.
     */
    record ImportFrom(String module, List<Alias> names, boolean wildcard, Span span) implements Stmt {
        public ImportFrom {
            names = List.copyOf(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitImportFrom(this, param);
        }
    }

    /**
     * An imported name with its optional {@code as} alias.
     */
    record Alias(String name, String asName) {

        /**
         * Name bound by {@code import name [as asName]}: the alias, or the first dotted segment.
         */
        public String boundByImport() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot >= 0 ? name.substring(0, dot) : name;
        }

        /**
         * Name bound by {@code from m import name [as asName]}.
         */
        public String boundByFromImport() {
            return asName != null ? asName : name;
        }
    }

    /**
     * {@code global} or {@code nonlocal} declaration.
     */
    record Global(List<String> names, boolean nonlocal, Span span) implements Stmt {
        public Global {
            names = List.copyOf(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitGlobal(this, param);
        }
    }

    record ExprStmt(Expr value, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitExprStmt(this, param);
        }
    }

    /**
     * {@code pass}, {@code break} or {@code continue}.
     */
    record Simple(String keyword, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSimple(this, param);
        }
    }

    /**
     * A statement shape the model does not describe (type aliases, ...).
     * Detectors have no opinion about it and do not look inside.
     */
    record Unsupported(String nodeType, Span span) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUnsupported(this, param);
        }
    }
}
