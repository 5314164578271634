package org.pragmatica.algebra.ast;

/**
 * Binary operators.
 */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    POWER('^');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Operands of {@code +} and {@code *} may be reordered without changing the value.
     */
    public boolean isCommutative() {
        return this == ADD || this == MULTIPLY;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
