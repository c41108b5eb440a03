package org.mathtutor.expression.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal such as {@code 3} or {@code 2.5}. */
    NUMBER,
    /** A variable name: letters followed by optional digits, e.g. {@code x}, {@code xy}, {@code x1}. */
    VARIABLE,

    // Operators.
    /** The '+' character. */
    PLUS,
    /** The '-' character, used both for subtraction and negation. */
    MINUS,
    /** The '*' character (also '×' and '·'), or an implicit multiplication. */
    MULTIPLY,
    /** The '/' character (also '÷'). */
    DIVIDE,
    /** The '^' character. */
    POWER,

    // Delimiters.
    /** The '(' character. */
    LPAREN,
    /** The ')' character. */
    RPAREN,

    // Miscellaneous.
    /** Represents the end of the input. */
    EOF
}
