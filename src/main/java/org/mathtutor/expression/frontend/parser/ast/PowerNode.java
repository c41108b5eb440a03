package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

import java.util.List;

/**
 * An AST node that represents a base raised to a constant exponent.
 *
 * @param base The base expression.
 * @param exponent The exponent; the grammar only accepts a literal here.
 * @param span The source span of the power, may be {@code null}.
 */
public record PowerNode(
        AstNode base,
        double exponent,
        SourceSpan span
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(base);
    }

    @Override
    public PowerNode withSpan(SourceSpan span) {
        return new PowerNode(base, exponent, span);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visitPower(this);
    }
}
