package io.pyscan.syntax;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Expression variants. Binding positions (assignment and loop targets) reuse
 * {@link Name}, {@link Sequence}, {@link Starred}, {@link Attribute} and {@link Subscript}.
 */
public sealed interface Expr extends Node {

    record Name(String id, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitName(this, param);
        }
    }

    /**
     * A literal. {@code text} is the literal exactly as written.
     */
    record Constant(Kind kind, String text, Span span) implements Expr {

        public enum Kind {
            INT,
            FLOAT,
            COMPLEX,
            STRING,
            TRUE,
            FALSE,
            NONE,
            ELLIPSIS
        }

        public boolean isNone() {
            return kind == Kind.NONE;
        }

        /**
         * True for int literals, {@code True} and {@code False} included since bool is an int subtype.
         */
        public boolean isInteger() {
            return kind == Kind.INT || kind == Kind.TRUE || kind == Kind.FALSE;
        }

        /**
         * True for int, bool and float literals whose value is zero
         * ({@code 0}, {@code 0x0}, {@code False}, {@code 0.0}, {@code 0e5}). Complex literals never count.
         */
        public boolean isNumericZero() {
            if (kind == Kind.FALSE) {
                return true;
            }
            String normalized = text.replace("_", "").toLowerCase(Locale.ROOT);
            if (kind == Kind.INT) {
                if (normalized.endsWith("l")) {
                    normalized = normalized.substring(0, normalized.length() - 1);
                }
                if (normalized.startsWith("0x") || normalized.startsWith("0o") || normalized.startsWith("0b")) {
                    normalized = normalized.substring(2);
                }
                return !normalized.isEmpty() && normalized.chars().allMatch(c -> c == '0');
            }
            if (kind == Kind.FLOAT) {
                try {
                    return Double.parseDouble(normalized) == 0.0;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
            return false;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitConstant(this, param);
        }
    }

    record BinOp(Expr left, Op op, Expr right, Span span) implements Expr {

        public enum Op {
            ADD("+"),
            SUB("-"),
            MULT("*"),
            MAT_MULT("@"),
            DIV("/"),
            FLOOR_DIV("//"),
            MOD("%"),
            POW("**"),
            LSHIFT("<<"),
            RSHIFT(">>"),
            BIT_OR("|"),
            BIT_XOR("^"),
            BIT_AND("&");

            private final String token;

            Op(String token) {
                this.token = token;
            }

            public String token() {
                return token;
            }

            /**
             * True for the operators that raise ZeroDivisionError on a zero right operand.
             */
            public boolean isDivision() {
                return this == DIV || this == FLOOR_DIV || this == MOD;
            }

            /**
             * Resolves a binary operator token; augmented forms such as {@code /=} are accepted too.
             */
            public static Optional<Op> fromToken(String token) {
                String bare = token.trim();
                if (bare.endsWith("=") && bare.length() > 1) {
                    bare = bare.substring(0, bare.length() - 1);
                }
                for (Op op : values()) {
                    if (op.token.equals(bare)) {
                        return Optional.of(op);
                    }
                }
                return Optional.empty();
            }
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBinOp(this, param);
        }
    }

    record UnaryOp(Op op, Expr operand, Span span) implements Expr {

        public enum Op {
            NOT,
            NEGATE,
            PLUS,
            INVERT;

            public static Optional<Op> fromToken(String token) {
                return switch (token.trim()) {
                    case "not" -> Optional.of(NOT);
                    case "-" -> Optional.of(NEGATE);
                    case "+" -> Optional.of(PLUS);
                    case "~" -> Optional.of(INVERT);
                    default -> Optional.empty();
                };
            }
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUnaryOp(this, param);
        }
    }

    record BoolOp(Op op, List<Expr> values, Span span) implements Expr {

        public enum Op {
            AND,
            OR
        }

        public BoolOp {
            values = List.copyOf(values);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBoolOp(this, param);
        }
    }

    /**
     * {@code left op1 c1 op2 c2 ...}; {@code ops} and {@code comparators} have equal size.
     */
    record Compare(Expr left, List<Op> ops, List<Expr> comparators, Span span) implements Expr {

        public enum Op {
            EQ,
            NOT_EQ,
            LT,
            LT_E,
            GT,
            GT_E,
            IS,
            IS_NOT,
            IN,
            NOT_IN;

            public boolean isEquality() {
                return this == EQ || this == NOT_EQ;
            }

            /**
             * Resolves an operator written with arbitrary inner whitespace, e.g. {@code "not   in"}.
             */
            public static Optional<Op> fromToken(String token) {
                String normalized = token.trim().replaceAll("\\s+", " ");
                return switch (normalized) {
                    case "==" -> Optional.of(EQ);
                    case "!=", "<>" -> Optional.of(NOT_EQ);
                    case "<" -> Optional.of(LT);
                    case "<=" -> Optional.of(LT_E);
                    case ">" -> Optional.of(GT);
                    case ">=" -> Optional.of(GT_E);
                    case "is" -> Optional.of(IS);
                    case "is not" -> Optional.of(IS_NOT);
                    case "in" -> Optional.of(IN);
                    case "not in" -> Optional.of(NOT_IN);
                    default -> Optional.empty();
                };
            }
        }

        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
            if (ops.size() != comparators.size()) {
                throw new IllegalArgumentException("ops and comparators must have the same size");
            }
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCompare(this, param);
        }
    }

    record Call(Expr func, List<Expr> args, List<Keyword> keywords, Span span) implements Expr {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCall(this, param);
        }
    }

    /**
     * {@code name=value} argument; a {@code **mapping} argument has a null name.
     */
    record Keyword(String name, Expr value) {
    }

    record Attribute(Expr value, String attr, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAttribute(this, param);
        }
    }

    record Subscript(Expr value, Expr slice, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSubscript(this, param);
        }
    }

    /**
     * {@code lower:upper:step}; each part may be null.
     */
    record Slice(Expr lower, Expr upper, Expr step, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSlice(this, param);
        }
    }

    /**
     * Tuple, list or set display.
     */
    record Sequence(Kind kind, List<Expr> elements, Span span) implements Expr {

        public enum Kind {
            TUPLE,
            LIST,
            SET
        }

        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSequence(this, param);
        }
    }

    record Dict(List<DictEntry> entries, Span span) implements Expr {
        public Dict {
            entries = List.copyOf(entries);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDict(this, param);
        }
    }

    /**
     * {@code key: value}; a {@code **mapping} entry has a null key.
     */
    record DictEntry(Expr key, Expr value) {
    }

    /**
     * {@code *value} or {@code **value}.
     */
    record Starred(Expr value, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitStarred(this, param);
        }
    }

    record Lambda(List<Parameter> params, Expr body, Span span) implements Expr {
        public Lambda {
            params = List.copyOf(params);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLambda(this, param);
        }
    }

    /**
     * List/set comprehension or generator expression.
     */
    record Comprehension(Kind kind, Expr element, List<Generator> generators, Span span) implements Expr {

        public enum Kind {
            LIST,
            SET,
            GENERATOR
        }

        public Comprehension {
            generators = List.copyOf(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitComprehension(this, param);
        }
    }

    record DictComprehension(Expr key, Expr value, List<Generator> generators, Span span) implements Expr {
        public DictComprehension {
            generators = List.copyOf(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDictComprehension(this, param);
        }
    }

    /**
     * One {@code for target in iter [if cond]...} clause of a comprehension.
     */
    record Generator(Expr target, Expr iter, List<Expr> ifs, boolean async) {
        public Generator {
            ifs = List.copyOf(ifs);
        }
    }

    /**
     * {@code body if test else orElse}.
     */
    record IfExp(Expr test, Expr body, Expr orElse, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIfExp(this, param);
        }
    }

    /**
     * Assignment expression {@code target := value}.
     */
    record NamedExpr(Name target, Expr value, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNamedExpr(this, param);
        }
    }

    record Await(Expr value, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAwait(this, param);
        }
    }

    /**
     * {@code yield [value]} or {@code yield from value}; value may be null.
     */
    record Yield(Expr value, boolean from, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitYield(this, param);
        }
    }

    /**
     * f-string; {@code values} are the interpolated expressions in source order.
     */
    record FormattedString(List<Expr> values, Span span) implements Expr {
        public FormattedString {
            values = List.copyOf(values);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFormattedString(this, param);
        }
    }

    /**
     * An expression shape the model does not describe. Detectors skip it.
     */
    record Unsupported(String nodeType, Span span) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUnsupported(this, param);
        }
    }
}
