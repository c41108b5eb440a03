package org.mathtutor.expression.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while tokenizing or parsing an expression.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param position The character offset in the normalized input the message refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        int position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the expression from being parsed. */
        ERROR,
        /** A problem that was tolerated, such as a skipped character. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] @%d: %s", type, position, message);
    }
}
