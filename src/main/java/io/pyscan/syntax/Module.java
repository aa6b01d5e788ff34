package io.pyscan.syntax;

import java.util.List;

/**
 * Root of a parsed source file.
 */
public record Module(List<Stmt> body, Span span) implements Node {

    public Module {
        body = List.copyOf(body);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitModule(this, param);
    }
}
