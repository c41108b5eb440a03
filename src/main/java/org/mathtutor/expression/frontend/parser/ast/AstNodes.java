package org.mathtutor.expression.frontend.parser.ast;

/**
 * Shape predicates shared by the evaluator and the analyzers.
 */
public final class AstNodes {

    private AstNodes() {}

    /**
     * @param node The node to test.
     * @return {@code true} if the node is an addition or subtraction.
     */
    public static boolean isAdditive(AstNode node) {
        return node instanceof BinaryNode binary && binary.operator().isAdditive();
    }

    /**
     * @param node The node to test.
     * @return {@code true} if the node is a multiplication or division.
     */
    public static boolean isMultiplicative(AstNode node) {
        return node instanceof BinaryNode binary && binary.operator().isMultiplicative();
    }

    /**
     * @param node The node to test.
     * @return {@code true} if the node is a division.
     */
    public static boolean isFraction(AstNode node) {
        return node instanceof BinaryNode binary && binary.operator() == BinaryOperator.DIVIDE;
    }

    /**
     * @param node The node to test.
     * @return {@code true} if the node is a division of one numeric literal by another.
     */
    public static boolean isLiteralFraction(AstNode node) {
        return node instanceof BinaryNode binary
                && binary.operator() == BinaryOperator.DIVIDE
                && binary.left() instanceof NumberNode
                && binary.right() instanceof NumberNode;
    }
}
