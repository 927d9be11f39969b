package org.kidoni.symalg;

/**
 * Raised when a power has no finite real value, e.g. {@code 0 ** -1} or {@code -8 ** 0.5}, or when a result's
 * decimal exponent is outside the range a {@link java.math.BigDecimal} can hold, e.g. {@code 10 ** 999999999}.
 */
public class InvalidExponentException extends ExpressionException {
    public InvalidExponentException(final String message) {
        super(message);
    }

    public InvalidExponentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
