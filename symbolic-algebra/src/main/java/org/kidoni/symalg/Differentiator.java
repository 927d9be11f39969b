package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.Objects;

import static org.kidoni.symalg.Expr.of;

/**
 * Builds the derivative of an expression with respect to one variable using the sum, product, quotient and
 * power rules. The result is not simplified; see {@link Simplifier}.
 * <p>
 * A power is differentiable when its exponent does not mention the variable. An exponent that does
 * ({@code x ** x}) is rejected with {@link UnsupportedOperationException}.
 */
public class Differentiator {
    private static final Expr ZERO = new Expr.NumExpr(BigDecimal.ZERO);
    private static final Expr ONE = new Expr.NumExpr(BigDecimal.ONE);

    private final String variable;

    public Differentiator(final String variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public Expr differentiate(final Expr expr) {
        if (expr instanceof Expr.NumExpr) {
            return ZERO;
        }
        if (expr instanceof Expr.VarExpr v) {
            return v.name().equals(variable) ? ONE : ZERO;
        }

        Expr.BinaryExpr b = (Expr.BinaryExpr) expr;
        Expr u = b.left();
        Expr w = b.right();

        return switch (b.op()) {
            case ADD -> of(Op.ADD, differentiate(u), differentiate(w));
            case SUB -> of(Op.SUB, differentiate(u), differentiate(w));
            case MUL -> of(Op.ADD,
                    of(Op.MUL, differentiate(u), w),
                    of(Op.MUL, u, differentiate(w)));
            case DIV -> of(Op.DIV,
                    of(Op.SUB, of(Op.MUL, differentiate(u), w), of(Op.MUL, u, differentiate(w))),
                    of(Op.MUL, w, w));
            case POW -> differentiatePower(u, w);
        };
    }

    private Expr differentiatePower(final Expr base, final Expr exponent) {
        final Expr reduced;
        if (exponent instanceof Expr.NumExpr n) {
            reduced = new Expr.NumExpr(n.value().subtract(BigDecimal.ONE));
        }
        else if (!exponent.variables().contains(variable)) {
            reduced = of(Op.SUB, exponent, ONE);
        }
        else {
            throw new UnsupportedOperationException("cannot differentiate " + of(Op.POW, base, exponent)
                    + " with respect to " + variable + ": the exponent depends on it");
        }

        return of(Op.MUL, of(Op.MUL, exponent, of(Op.POW, base, reduced)), differentiate(base));
    }
}
