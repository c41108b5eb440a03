package org.mathtutor.expression.api;

/**
 * Thrown when a token sequence cannot be parsed as a single expression.
 * <p>
 * It is part of the public API and carries the character offset at which parsing failed,
 * so callers can point at the offending part of the input.
 */
public class ParseException extends Exception {

    private final int position;

    /**
     * Constructs a new parse exception.
     * @param message The detail message.
     * @param position The character offset of the offending token.
     */
    public ParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return The character offset of the offending token in the normalized input.
     */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return String.format("ParseException: %s at %d", getMessage(), position);
    }
}
