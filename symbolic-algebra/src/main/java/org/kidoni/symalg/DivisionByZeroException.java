package org.kidoni.symalg;

public class DivisionByZeroException extends ExpressionException {
    public DivisionByZeroException(final String message) {
        super(message);
    }
}
