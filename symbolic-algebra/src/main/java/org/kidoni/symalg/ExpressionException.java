package org.kidoni.symalg;

/**
 * Base type for every failure raised while evaluating or parsing an {@link Expr}.
 */
public abstract class ExpressionException extends RuntimeException {
    protected ExpressionException(final String message) {
        super(message);
    }

    protected ExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
