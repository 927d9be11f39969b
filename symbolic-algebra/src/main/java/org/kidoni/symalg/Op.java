package org.kidoni.symalg;

import java.util.Arrays;
import java.util.Optional;

/**
 * The five binary operators. A {@code switch} over this enum must cover every constant, so adding an
 * operator is checked by the compiler in every algorithm.
 */
public enum Op {
    ADD("+", 1, false, false),
    SUB("-", 1, false, true),
    MUL("*", 2, false, false),
    DIV("/", 2, false, true),
    POW("**", 3, true, false);

    private final String symbol;
    private final int precedence;
    private final boolean wrapLeftAtSamePrecedence;
    private final boolean wrapRightAtSamePrecedence;

    Op(final String symbol, final int precedence, final boolean wrapLeftAtSamePrecedence, final boolean wrapRightAtSamePrecedence) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.wrapLeftAtSamePrecedence = wrapLeftAtSamePrecedence;
        this.wrapRightAtSamePrecedence = wrapRightAtSamePrecedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    boolean wrapLeftAtSamePrecedence() {
        return wrapLeftAtSamePrecedence;
    }

    boolean wrapRightAtSamePrecedence() {
        return wrapRightAtSamePrecedence;
    }

    public static Optional<Op> fromSymbol(final String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
