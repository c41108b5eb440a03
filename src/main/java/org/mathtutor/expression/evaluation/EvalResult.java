package org.mathtutor.expression.evaluation;

import org.mathtutor.expression.frontend.parser.ast.AstNode;

/**
 * The outcome of evaluating an expression: either a finite number, or the
 * expression itself when it cannot be reduced to a number.
 */
public sealed interface EvalResult {

    /**
     * @return {@code true} if the expression folded to a number.
     */
    boolean isNumeric();

    /**
     * The expression folded to a finite value.
     *
     * @param value The value.
     */
    record Numeric(double value) implements EvalResult {
        @Override
        public boolean isNumeric() {
            return true;
        }
    }

    /**
     * The expression contains a variable, a division by zero, or another part that
     * cannot be computed.
     *
     * @param node The node that could not be folded.
     */
    record Symbolic(AstNode node) implements EvalResult {
        @Override
        public boolean isNumeric() {
            return false;
        }
    }
}
