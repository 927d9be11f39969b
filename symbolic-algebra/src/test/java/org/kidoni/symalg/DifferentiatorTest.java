package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DifferentiatorTest {
    private static final Expr X = Expr.var("x");
    private static final Expr Y = Expr.var("y");

    @Test
    void leaves() {
        assertEquals(Expr.num(0), Expr.num(5).differentiate("x"));
        assertEquals(Expr.num(1), X.differentiate("x"));
        assertEquals(Expr.num(0), Y.differentiate("x"));
    }

    @Test
    void sumAndDifference() {
        assertEquals(Expr.num(1).plus(0), X.plus(Y).differentiate("x"));
        assertEquals(Expr.num(0).minus(1), X.minus(Y).differentiate("y"));
    }

    @Test
    void productRule() {
        var derivative = Expr.parse("(2 * x)").differentiate("x");
        assertEquals(Expr.num(0).times(X).plus(Expr.num(2).times(1)), derivative);
        assertEquals("2", derivative.simplify().render());
    }

    @Test
    void quotientRule() {
        var derivative = X.dividedBy(Y).differentiate("x");
        var expected = Expr.num(1).times(Y).minus(X.times(0)).dividedBy(Y.times(Y));
        assertEquals(expected, derivative);
        assertEquals("(y / (y * y))", derivative.simplify().render());
    }

    @Test
    void powerRule() {
        var derivative = X.pow(3).differentiate("x");
        assertEquals(Expr.num(3).times(X.pow(2)).times(1), derivative);
        assertEquals("(3 * (x ** 2))", derivative.simplify().render());
    }

    @Test
    void chainRule() {
        var derivative = X.times(X).plus(1).pow(2).differentiate("x").simplify();
        // 2 (x^2 + 1) * 2x
        assertEquals(new BigDecimal("40"), derivative.evaluate(Map.of("x", 2)));
    }

    @Test
    void exponentFreeOfVariable() {
        var derivative = X.pow(Y).differentiate("x");
        assertEquals(Y.times(X.pow(Y.minus(1))).times(1), derivative);
        assertEquals(new BigDecimal("12"), derivative.evaluate(Map.of("x", 2, "y", 3)));
    }

    @Test
    void exponentDependingOnVariableIsUnsupported() {
        assertThrows(UnsupportedOperationException.class, () -> X.pow(X).differentiate("x"));
        assertThrows(UnsupportedOperationException.class, () -> Expr.num(2).pow(X.plus(1)).differentiate("x"));
    }

    @Test
    void squareDerivativeIsTwoX() {
        var derivative = X.times(X).differentiate("x").simplify();
        for (int v : new int[] {-3, 0, 1, 7}) {
            assertEquals(BigDecimal.valueOf(2L * v), derivative.evaluate(Map.of("x", v)));
        }
    }

    @Test
    void divisionByZeroIsNeverRaised() {
        var derivative = Expr.parse("(1 / 0)").differentiate("x");
        assertEquals("(((0 * 0) - (1 * 0)) / (0 * 0))", derivative.render());
    }
}
