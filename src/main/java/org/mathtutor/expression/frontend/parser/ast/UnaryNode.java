package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a negation.
 *
 * @param operand The negated expression.
 * @param span The source span from the minus sign to the end of the operand, may be {@code null}.
 */
public record UnaryNode(
        AstNode operand,
        SourceSpan span
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public UnaryNode withSpan(SourceSpan span) {
        return new UnaryNode(operand, span);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
