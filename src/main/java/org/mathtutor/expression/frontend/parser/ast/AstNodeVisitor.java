package org.mathtutor.expression.frontend.parser.ast;

/**
 * Computes a result for each kind of {@link AstNode}.
 *
 * @param <R> The result type.
 */
public interface AstNodeVisitor<R> {

    R visitNumber(NumberNode node);

    R visitVariable(VariableNode node);

    R visitBinary(BinaryNode node);

    R visitUnary(UnaryNode node);

    R visitPower(PowerNode node);
}
