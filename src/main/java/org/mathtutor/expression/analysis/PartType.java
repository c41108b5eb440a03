package org.mathtutor.expression.analysis;

/**
 * The part of an exercise a source span was taken from.
 */
public enum PartType {
    /** The numerator of a fraction. */
    NUMERATOR,
    /** The denominator of a fraction. */
    DENOMINATOR,
    /** A standalone expression. */
    EXPRESSION
}
