package io.pyscan.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExprTest {

    private static final Span SPAN = new Span(1, 0, 1);

    private static Expr.Constant constant(Expr.Constant.Kind kind, String text) {
        return new Expr.Constant(kind, text, SPAN);
    }

    @Test
    void isNumericZero_recognisesIntSpellings() {
        assertThat(constant(Expr.Constant.Kind.INT, "0").isNumericZero()).isTrue();
        assertThat(constant(Expr.Constant.Kind.INT, "0x0").isNumericZero()).isTrue();
        assertThat(constant(Expr.Constant.Kind.INT, "0_0").isNumericZero()).isTrue();
        assertThat(constant(Expr.Constant.Kind.INT, "10").isNumericZero()).isFalse();
    }

    @Test
    void isNumericZero_recognisesFloatSpellings() {
        assertThat(constant(Expr.Constant.Kind.FLOAT, "0.0").isNumericZero()).isTrue();
        assertThat(constant(Expr.Constant.Kind.FLOAT, "0e10").isNumericZero()).isTrue();
        assertThat(constant(Expr.Constant.Kind.FLOAT, "0.5").isNumericZero()).isFalse();
    }

    @Test
    void isNumericZero_ignoresNonNumericKinds() {
        assertThat(constant(Expr.Constant.Kind.COMPLEX, "0j").isNumericZero()).isFalse();
        assertThat(constant(Expr.Constant.Kind.TRUE, "True").isNumericZero()).isFalse();
        assertThat(constant(Expr.Constant.Kind.STRING, "'0'").isNumericZero()).isFalse();
    }

    @Test
    void isNumericZero_treatsFalseAsZero() {
        assertThat(constant(Expr.Constant.Kind.FALSE, "False").isNumericZero()).isTrue();
    }

    @Test
    void isInteger_includesBoolLiterals() {
        assertThat(constant(Expr.Constant.Kind.INT, "5").isInteger()).isTrue();
        assertThat(constant(Expr.Constant.Kind.TRUE, "True").isInteger()).isTrue();
        assertThat(constant(Expr.Constant.Kind.FALSE, "False").isInteger()).isTrue();
        assertThat(constant(Expr.Constant.Kind.FLOAT, "5.0").isInteger()).isFalse();
        assertThat(constant(Expr.Constant.Kind.NONE, "None").isInteger()).isFalse();
    }

    @Test
    void binOpFromToken_acceptsAugmentedForms() {
        assertThat(Expr.BinOp.Op.fromToken("//=")).contains(Expr.BinOp.Op.FLOOR_DIV);
        assertThat(Expr.BinOp.Op.fromToken("%")).contains(Expr.BinOp.Op.MOD);
        assertThat(Expr.BinOp.Op.fromToken("?")).isEmpty();
    }

    @Test
    void compareFromToken_normalisesWhitespace() {
        assertThat(Expr.Compare.Op.fromToken(" is   not ")).contains(Expr.Compare.Op.IS_NOT);
        assertThat(Expr.Compare.Op.fromToken("<>")).contains(Expr.Compare.Op.NOT_EQ);
    }
}
