package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bottom-up rewriting into a smaller expression with the same value: constant folding plus removal of the
 * identities {@code x + 0}, {@code x - 0}, {@code x * 1}, {@code x / 1}, {@code x ** 1}, and the
 * absorbing rules {@code x * 0 = 0} and {@code x ** 0 = 1} (including {@code 0 ** 0}).
 * <p>
 * Only exact results that a {@link BigDecimal} can hold are folded; anything else stays symbolic. A division by
 * a literal zero is kept as written so that evaluation, not simplification, reports it. Simplifying never
 * throws and the result is a fixed point.
 */
public final class Simplifier {
    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    private static final Expr.NumExpr ZERO = new Expr.NumExpr(BigDecimal.ZERO);
    private static final Expr.NumExpr ONE = new Expr.NumExpr(BigDecimal.ONE);

    private Simplifier() {
    }

    public static Expr simplify(final Expr expr) {
        if (!(expr instanceof Expr.BinaryExpr b)) {
            return expr;
        }

        Expr left = simplify(b.left());
        Expr right = simplify(b.right());

        Expr result = switch (b.op()) {
            case ADD -> simplifyAdd(left, right);
            case SUB -> simplifySub(left, right);
            case MUL -> simplifyMul(left, right);
            case DIV -> simplifyDiv(left, right);
            case POW -> simplifyPow(left, right);
        };

        if (LOG.isTraceEnabled() && !result.equals(b)) {
            LOG.trace("{} => {}", b.render(), result.render());
        }
        return result;
    }

    private static Expr simplifyAdd(final Expr left, final Expr right) {
        if (left instanceof Expr.NumExpr a && right instanceof Expr.NumExpr c) {
            Optional<BigDecimal> sum = Arithmetic.addExact(a.value(), c.value());
            if (sum.isPresent()) {
                return new Expr.NumExpr(sum.get());
            }
        }
        if (isNumber(left, 0)) {
            return right;
        }
        if (isNumber(right, 0)) {
            return left;
        }
        return Expr.of(Op.ADD, left, right);
    }

    private static Expr simplifySub(final Expr left, final Expr right) {
        if (left instanceof Expr.NumExpr a && right instanceof Expr.NumExpr c) {
            Optional<BigDecimal> difference = Arithmetic.subtractExact(a.value(), c.value());
            if (difference.isPresent()) {
                return new Expr.NumExpr(difference.get());
            }
        }
        if (isNumber(right, 0)) {
            return left;
        }
        return Expr.of(Op.SUB, left, right);
    }

    private static Expr simplifyMul(final Expr left, final Expr right) {
        if (left instanceof Expr.NumExpr a && right instanceof Expr.NumExpr c) {
            Optional<BigDecimal> product = Arithmetic.multiplyExact(a.value(), c.value());
            if (product.isPresent()) {
                return new Expr.NumExpr(product.get());
            }
        }
        if (isNumber(left, 0) || isNumber(right, 0)) {
            return ZERO;
        }
        if (isNumber(left, 1)) {
            return right;
        }
        if (isNumber(right, 1)) {
            return left;
        }
        return Expr.of(Op.MUL, left, right);
    }

    private static Expr simplifyDiv(final Expr left, final Expr right) {
        if (left instanceof Expr.NumExpr a && right instanceof Expr.NumExpr c) {
            Optional<BigDecimal> quotient = Arithmetic.divideExact(a.value(), c.value());
            if (quotient.isPresent()) {
                return new Expr.NumExpr(quotient.get());
            }
        }
        if (isNumber(right, 1)) {
            return left;
        }
        return Expr.of(Op.DIV, left, right);
    }

    private static Expr simplifyPow(final Expr base, final Expr exponent) {
        if (isNumber(exponent, 0)) {
            return ONE;
        }
        if (isNumber(exponent, 1)) {
            return base;
        }
        if (base instanceof Expr.NumExpr a && exponent instanceof Expr.NumExpr n) {
            Optional<BigDecimal> power = Arithmetic.powExact(a.value(), n.value());
            if (power.isPresent()) {
                return new Expr.NumExpr(power.get());
            }
        }
        return Expr.of(Op.POW, base, exponent);
    }

    private static boolean isNumber(final Expr expr, final long n) {
        return expr instanceof Expr.NumExpr num && num.is(n);
    }
}
