package org.mathtutor.expression.api;

/**
 * A half-open range {@code [start, end)} of character offsets into the source string
 * an expression was parsed from.
 * <p>
 * A span with {@code start == end} is zero-width; the lexer uses such spans for the
 * implicit multiplication it inserts between a number and an adjacent variable.
 *
 * @param start The offset of the first character covered by the span.
 * @param end The offset one past the last character covered by the span.
 */
public record SourceSpan(int start, int end) {

    /**
     * Validates the offsets.
     */
    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates a zero-width span at the given offset.
     * @param offset The offset of the span.
     * @return A span with {@code start == end == offset}.
     */
    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    /**
     * @return The number of characters covered by this span.
     */
    public int length() {
        return end - start;
    }

    /**
     * @return {@code true} if the span covers no characters.
     */
    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Checks whether two spans intersect as half-open intervals.
     * Zero-width spans never overlap anything.
     *
     * @param other The span to test against.
     * @return {@code true} if {@code start < other.end && other.start < end}.
     */
    public boolean overlaps(SourceSpan other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
