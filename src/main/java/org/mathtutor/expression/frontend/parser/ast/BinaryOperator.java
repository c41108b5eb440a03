package org.mathtutor.expression.frontend.parser.ast;

/**
 * The operators of a {@link BinaryNode}, with their precedence.
 */
public enum BinaryOperator {
    /** Addition. */
    ADD('+', 1),
    /** Subtraction. */
    SUBTRACT('-', 1),
    /** Multiplication. */
    MULTIPLY('*', 2),
    /** Division. */
    DIVIDE('/', 2);

    private final char symbol;
    private final int precedence;

    BinaryOperator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * @return The ASCII symbol of the operator.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * @return The binding strength; higher binds tighter.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * @return {@code true} for {@code +} and {@code -}.
     */
    public boolean isAdditive() {
        return precedence == 1;
    }

    /**
     * @return {@code true} for {@code *} and {@code /}.
     */
    public boolean isMultiplicative() {
        return precedence == 2;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
