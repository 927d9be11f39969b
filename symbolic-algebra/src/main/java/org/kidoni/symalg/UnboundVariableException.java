package org.kidoni.symalg;

public class UnboundVariableException extends ExpressionException {
    private final String name;

    public UnboundVariableException(final String name) {
        super("no binding for variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
