package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * An immutable symbolic expression: a number, a variable, or a binary operation over two owned
 * sub-expressions. Equality is structural.
 * <p>
 * Trees can be built directly,
 * <pre>
 *  Expr e = Expr.var("x").times(2).plus(Expr.var("y").pow(3));
 * </pre>
 * or parsed from their fully parenthesized text with {@link #parse(String)}.
 */
public sealed interface Expr {
    record NumExpr(BigDecimal value) implements Expr {
        public NumExpr {
            Objects.requireNonNull(value, "value");
            try {
                value = Arithmetic.normalize(value);
            }
            catch (ArithmeticException e) {
                throw new IllegalArgumentException("number out of range: " + value, e);
            }
        }

        boolean is(final long n) {
            return value.compareTo(BigDecimal.valueOf(n)) == 0;
        }

        @Override
        public String toString() {
            return Renderer.pretty(this);
        }
    }

    record VarExpr(String name) implements Expr {
        private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

        public VarExpr {
            Objects.requireNonNull(name, "name");
            if (!isIdentifier(name)) {
                throw new IllegalArgumentException("not a valid variable name: '" + name + "'");
            }
        }

        static boolean isIdentifier(final String text) {
            return IDENTIFIER.matcher(text).matches();
        }

        @Override
        public String toString() {
            return Renderer.pretty(this);
        }
    }

    record BinaryExpr(Op op, Expr left, Expr right) implements Expr {
        public BinaryExpr {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return Renderer.pretty(this);
        }
    }

    static Expr num(final Number value) {
        return new NumExpr(Arithmetic.toDecimal(value));
    }

    static Expr var(final String name) {
        return new VarExpr(name);
    }

    static Expr of(final Op op, final Expr left, final Expr right) {
        return new BinaryExpr(op, left, right);
    }

    static Expr parse(final String text) {
        return Parser.parse(text);
    }

    default BigDecimal evaluate(final Map<String, ? extends Number> bindings) {
        return new Evaluator(bindings).evaluate(this);
    }

    default Expr differentiate(final String variableName) {
        return new Differentiator(variableName).differentiate(this);
    }

    default Expr simplify() {
        return Simplifier.simplify(this);
    }

    /**
     * Fully parenthesized text accepted by {@link #parse(String)}.
     */
    default String render() {
        return Renderer.render(this);
    }

    default SortedSet<String> variables() {
        SortedSet<String> names = new TreeSet<>();
        collectVariables(this, names);
        return names;
    }

    private static void collectVariables(final Expr expr, final SortedSet<String> names) {
        if (expr instanceof VarExpr v) {
            names.add(v.name());
        }
        else if (expr instanceof BinaryExpr b) {
            collectVariables(b.left(), names);
            collectVariables(b.right(), names);
        }
    }

    default Expr plus(final Expr other) {
        return of(Op.ADD, this, other);
    }

    default Expr plus(final Number other) {
        return plus(num(other));
    }

    default Expr plus(final String other) {
        return plus(var(other));
    }

    default Expr minus(final Expr other) {
        return of(Op.SUB, this, other);
    }

    default Expr minus(final Number other) {
        return minus(num(other));
    }

    default Expr minus(final String other) {
        return minus(var(other));
    }

    default Expr times(final Expr other) {
        return of(Op.MUL, this, other);
    }

    default Expr times(final Number other) {
        return times(num(other));
    }

    default Expr times(final String other) {
        return times(var(other));
    }

    default Expr dividedBy(final Expr other) {
        return of(Op.DIV, this, other);
    }

    default Expr dividedBy(final Number other) {
        return dividedBy(num(other));
    }

    default Expr dividedBy(final String other) {
        return dividedBy(var(other));
    }

    default Expr pow(final Expr other) {
        return of(Op.POW, this, other);
    }

    default Expr pow(final Number other) {
        return pow(num(other));
    }

    default Expr pow(final String other) {
        return pow(var(other));
    }
}
