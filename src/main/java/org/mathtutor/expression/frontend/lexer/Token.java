package org.mathtutor.expression.frontend.lexer;

import org.mathtutor.expression.api.SourceSpan;

/**
 * Represents a single token extracted from an expression by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, VARIABLE, PLUS).
 * @param text The exact text of the token from the normalized input. Empty for EOF
 *             and {@code "*"} for an implicit multiplication.
 * @param value The parsed value of a NUMBER token, {@code null} for every other type.
 * @param span The characters of the normalized input covered by the token.
 */
public record Token(
        TokenType type,
        String text,
        Double value,
        SourceSpan span
) {

    /**
     * Checks if this token is a multiplication inserted by the lexer (as in {@code 3x}).
     * Such tokens have a zero-width span and should not be rendered.
     *
     * @return {@code true} for a zero-width MULTIPLY token.
     */
    public boolean isImplicit() {
        return type == TokenType.MULTIPLY && span.isEmpty();
    }
}
