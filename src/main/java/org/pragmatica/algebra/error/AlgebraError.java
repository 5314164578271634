package org.pragmatica.algebra.error;

/**
 * Failure raised by the expression pipeline, carrying the input position where it applies.
 * Every error is terminal for the call that raised it.
 */
public abstract sealed class AlgebraError extends RuntimeException permits LexError, ParseError, DivisionByZero {
    public static final int NO_POSITION = -1;

    private final int position;

    protected AlgebraError(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Zero-based offset into the input text, or {@link #NO_POSITION}.
     */
    public int position() {
        return position;
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }
}
