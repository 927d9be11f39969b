package org.kidoni.symalg;

/**
 * Text forms of an expression.
 * <p>
 * {@link #render(Expr)} parenthesizes every operation, e.g. {@code ((x * 2) + 1)}, and is the exact inverse of
 * {@link Parser}. {@link #pretty(Expr)} only adds the parentheses operator precedence requires, e.g.
 * {@code x * 2 + 1} or {@code x - (y - z)}, and is meant for display.
 */
public final class Renderer {
    private static final int LEAF_PRECEDENCE = Integer.MAX_VALUE;

    private Renderer() {
    }

    public static String render(final Expr expr) {
        StringBuilder builder = new StringBuilder();
        render(expr, builder);
        return builder.toString();
    }

    private static void render(final Expr expr, final StringBuilder builder) {
        if (expr instanceof Expr.BinaryExpr b) {
            builder.append('(');
            render(b.left(), builder);
            builder.append(' ').append(b.op().symbol()).append(' ');
            render(b.right(), builder);
            builder.append(')');
        }
        else {
            builder.append(leaf(expr));
        }
    }

    public static String pretty(final Expr expr) {
        if (!(expr instanceof Expr.BinaryExpr b)) {
            return leaf(expr);
        }

        Op op = b.op();
        String left = pretty(b.left());
        String right = pretty(b.right());

        int leftPrecedence = precedence(b.left());
        int rightPrecedence = precedence(b.right());

        if (leftPrecedence < op.precedence()
                || (leftPrecedence == op.precedence() && op.wrapLeftAtSamePrecedence())
                || (op == Op.POW && isNegativeNumber(b.left()))) {
            left = "(" + left + ")";
        }
        if (rightPrecedence < op.precedence()
                || (rightPrecedence == op.precedence() && op.wrapRightAtSamePrecedence())) {
            right = "(" + right + ")";
        }

        return left + " " + op.symbol() + " " + right;
    }

    private static String leaf(final Expr expr) {
        if (expr instanceof Expr.NumExpr n) {
            return n.value().toPlainString();
        }
        return ((Expr.VarExpr) expr).name();
    }

    private static int precedence(final Expr expr) {
        return expr instanceof Expr.BinaryExpr b ? b.op().precedence() : LEAF_PRECEDENCE;
    }

    private static boolean isNegativeNumber(final Expr expr) {
        return expr instanceof Expr.NumExpr n && n.value().signum() < 0;
    }
}
