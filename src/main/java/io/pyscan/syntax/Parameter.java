package io.pyscan.syntax;

/**
 * A function or lambda parameter.
 *
 * @param name         Parameter name
 * @param kind         How the parameter binds arguments
 * @param annotation   Type annotation, or null
 * @param defaultValue Default value expression, or null
 */
public record Parameter(String name, Kind kind, Expr annotation, Expr defaultValue) {

    public enum Kind {
        POSITIONAL,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }

    public Parameter {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (kind == null) {
            kind = Kind.POSITIONAL;
        }
    }
}
