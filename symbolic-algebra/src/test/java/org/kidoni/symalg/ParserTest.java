package org.kidoni.symalg;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParserTest {
    @Test
    void parseEmpty() {
        var e = assertThrows(MalformedExpressionException.class, () -> Parser.parse(""));
        assertTrue(e.getMessage().startsWith("unexpected end of input"));
        assertEquals(-1, e.getOffset());

        assertThrows(MalformedExpressionException.class, () -> Parser.parse("   "));
    }

    @Test
    void parseLeaves() {
        assertEquals(new Expr.NumExpr(new BigDecimal("123")), Parser.parse("123"));
        assertEquals(new Expr.NumExpr(new BigDecimal("2.5")), Parser.parse(" 2.50 "));
        assertEquals(new Expr.NumExpr(new BigDecimal("-3")), Parser.parse("-3"));
        assertEquals(new Expr.NumExpr(new BigDecimal("0.5")), Parser.parse(".5"));
        assertEquals(new Expr.NumExpr(new BigDecimal("1200")), Parser.parse("1.2e3"));
        assertEquals(new Expr.VarExpr("x"), Parser.parse("x"));
        assertEquals(new Expr.VarExpr("rate_2"), Parser.parse("rate_2"));
    }

    @Test
    void parseSimpleAdditionExpression() {
        var expression = Parser.parse("(123 + 456)");
        if (expression instanceof Expr.BinaryExpr expr) {
            assertEquals(Op.ADD, expr.op());
        }

        expression = Parser.parse("  ( 123  +  456 )  ");
        assertInstanceOf(Expr.BinaryExpr.class, expression);
        assertEquals(Op.ADD, ((Expr.BinaryExpr) expression).op());

        assertEquals("123 + 456", expression.toString());
    }

    @Test
    void parseEachOperator() {
        assertEquals(Expr.var("x").minus(1), Parser.parse("(x - 1)"));
        assertEquals(Expr.var("x").times(1), Parser.parse("(x * 1)"));
        assertEquals(Expr.var("x").dividedBy(1), Parser.parse("(x / 1)"));
        assertEquals(Expr.var("x").pow(2), Parser.parse("(x ** 2)"));
    }

    @Test
    void parseNested() {
        var expected = Expr.var("x").times(Expr.num(2).plus(3));
        assertEquals(expected, Parser.parse("(x * (2 + 3))"));

        var deep = Parser.parse("(((a + b) * (c - d)) / (e ** 2))");
        assertEquals("(a + b) * (c - d) / e ** 2", deep.toString());
    }

    @Test
    void parenthesesNeedNoSurroundingWhitespace() {
        assertEquals(Expr.var("y").plus(Expr.var("x").times(2)), Parser.parse("(y +(x * 2))"));
    }

    @Test
    void unbalancedParentheses() {
        var missingClose = assertThrows(MalformedExpressionException.class, () -> Parser.parse("((x + y)"));
        assertTrue(missingClose.getMessage().contains("expected ')'"));

        var extraClose = assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x + y))"));
        assertEquals(7, extraClose.getOffset());
    }

    @Test
    void missingOperator() {
        var e = assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x)"));
        assertTrue(e.getMessage().startsWith("missing operator"));
        assertEquals(2, e.getOffset());
    }

    @Test
    void unknownOperator() {
        var e = assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x % y)"));
        assertTrue(e.getMessage().contains("unknown operator '%'"));
        assertEquals(3, e.getOffset());
    }

    @Test
    void wrongArity() {
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x + y z)"));
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x +)"));
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("()"));
    }

    @Test
    void unparenthesizedOperationIsRejected() {
        var e = assertThrows(MalformedExpressionException.class, () -> Parser.parse("x + y"));
        assertTrue(e.getMessage().contains("after end of expression"));
    }

    @Test
    void unrecognizedValueToken() {
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x*2)"));
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("(+ + 1)"));
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("(1.2.3 + 1)"));
        assertThrows(MalformedExpressionException.class, () -> Parser.parse("$x"));
    }

    @Test
    void numberOutOfRange() {
        var tooLarge = assertThrows(MalformedExpressionException.class, () -> Parser.parse("1e2147483647"));
        assertTrue(tooLarge.getMessage().startsWith("number out of range"));
        assertEquals(0, tooLarge.getOffset());

        var tooSmall = assertThrows(MalformedExpressionException.class, () -> Parser.parse("(x + 1e-2147483648)"));
        assertEquals(5, tooSmall.getOffset());
    }

    @Test
    void parseFromTokens() {
        var tokens = Tokenizer.tokenize("(a / b)");
        assertEquals(Expr.var("a").dividedBy("b"), new Parser(tokens).parse());
    }

    @Test
    void exprParseDelegates() {
        assertEquals(Parser.parse("((x ** 2) - 1)"), Expr.parse("((x ** 2) - 1)"));
    }
}
