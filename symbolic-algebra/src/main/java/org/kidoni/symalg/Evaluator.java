package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the numeric value of an expression under a binding of variable names to numbers.
 */
public class Evaluator {
    private final Map<String, BigDecimal> bindings;

    public Evaluator(final Map<String, ? extends Number> bindings) {
        Objects.requireNonNull(bindings, "bindings");
        this.bindings = new HashMap<>();
        bindings.forEach((name, value) -> this.bindings.put(name, Arithmetic.toDecimal(value)));
    }

    /**
     * @throws UnboundVariableException  if a variable in {@code expr} has no binding
     * @throws DivisionByZeroException   if a divisor evaluates to zero
     * @throws InvalidExponentException  if a power has no finite real value
     */
    public BigDecimal evaluate(final Expr expr) {
        return Arithmetic.normalize(valueOf(expr));
    }

    private BigDecimal valueOf(final Expr expr) {
        if (expr instanceof Expr.NumExpr n) {
            return n.value();
        }
        if (expr instanceof Expr.VarExpr v) {
            BigDecimal value = bindings.get(v.name());
            if (value == null) {
                throw new UnboundVariableException(v.name());
            }
            return value;
        }

        Expr.BinaryExpr b = (Expr.BinaryExpr) expr;
        BigDecimal left = valueOf(b.left());
        BigDecimal right = valueOf(b.right());

        return switch (b.op()) {
            case ADD -> Arithmetic.add(left, right);
            case SUB -> Arithmetic.subtract(left, right);
            case MUL -> Arithmetic.multiply(left, right);
            case DIV -> Arithmetic.divide(left, right);
            case POW -> Arithmetic.pow(left, right);
        };
    }
}
