package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a binary arithmetic operation.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 * @param span The source span from the start of the left to the end of the right operand,
 *             may be {@code null}.
 */
public record BinaryNode(
        BinaryOperator operator,
        AstNode left,
        AstNode right,
        SourceSpan span
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public BinaryNode withSpan(SourceSpan span) {
        return new BinaryNode(operator, left, right, span);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
