package org.kidoni.symalg;

/**
 * Thrown by the {@link Parser} when its input does not match the fully parenthesized grammar.
 * The offset is the zero-based character position of the offending token, or {@code -1} when
 * the input ended early.
 */
public class MalformedExpressionException extends ExpressionException {
    private final int offset;

    public MalformedExpressionException(final String message) {
        this(message, -1);
    }

    public MalformedExpressionException(final String message, final int offset) {
        super(offset < 0 ? message : message + " at offset " + offset);
        this.offset = offset;
    }

    public MalformedExpressionException(final String message, final int offset, final Throwable cause) {
        super(offset < 0 ? message : message + " at offset " + offset, cause);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
