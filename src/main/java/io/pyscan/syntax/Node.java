package io.pyscan.syntax;

/**
 * A node of the analyzer's Python syntax model.
 * <p>
 * The model is a closed set of variants: {@link Module}, the {@link Stmt} variants and the
 * {@link Expr} variants. {@link NodeVisitor} has one method per variant, so adding a variant
 * without teaching every visitor about it does not compile.
 */
public sealed interface Node permits Module, Stmt, Expr {

    Span span();

    <R, P> R accept(NodeVisitor<R, P> visitor, P param);

    default int line() {
        return span().line();
    }
}
