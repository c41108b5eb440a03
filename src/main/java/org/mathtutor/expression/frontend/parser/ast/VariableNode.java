package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

/**
 * An AST node that represents a variable, optionally with a folded coefficient.
 * <p>
 * The parser always creates variables with coefficient 1 and expresses {@code 3x} as
 * {@code 3 * x}. The coefficient exists for pre-folded terms such as {@code -x}.
 *
 * @param name The full variable name, e.g. {@code x}, {@code xy} or {@code x1}.
 * @param coefficient The numeric coefficient of the variable.
 * @param span The source span of the variable, may be {@code null}.
 */
public record VariableNode(
        String name,
        double coefficient,
        SourceSpan span
) implements AstNode {

    /**
     * Creates a variable with coefficient 1.
     * @param name The variable name.
     * @param span The source span, may be {@code null}.
     */
    public VariableNode(String name, SourceSpan span) {
        this(name, 1, span);
    }

    @Override
    public VariableNode withSpan(SourceSpan span) {
        return new VariableNode(name, coefficient, span);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
