package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The value of the literal.
 * @param span The source span of the literal, may be {@code null}.
 */
public record NumberNode(
        double value,
        SourceSpan span
) implements AstNode {

    /**
     * Creates a literal without a source span.
     * @param value The value of the literal.
     */
    public NumberNode(double value) {
        this(value, null);
    }

    /**
     * @return {@code true} if the value is a whole number.
     */
    public boolean isInteger() {
        return Double.isFinite(value) && value == Math.rint(value);
    }

    @Override
    public NumberNode withSpan(SourceSpan span) {
        return new NumberNode(value, span);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    // This node has no children and inherits the empty list from getChildren().
}
