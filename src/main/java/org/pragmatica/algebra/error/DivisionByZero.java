package org.pragmatica.algebra.error;

/**
 * Division whose divisor normalizes to the constant zero.
 */
public final class DivisionByZero extends AlgebraError {
    private final String expression;

    public DivisionByZero(String expression) {
        super("Division by zero in " + expression, NO_POSITION);
        this.expression = expression;
    }

    /**
     * Infix rendering of the offending division.
     */
    public String expression() {
        return expression;
    }
}
