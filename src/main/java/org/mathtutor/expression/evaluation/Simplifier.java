package org.mathtutor.expression.evaluation;

import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.AstNodeVisitor;
import org.mathtutor.expression.frontend.parser.ast.BinaryNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryOperator;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;
import org.mathtutor.expression.frontend.parser.ast.PowerNode;
import org.mathtutor.expression.frontend.parser.ast.UnaryNode;
import org.mathtutor.expression.frontend.parser.ast.VariableNode;

import java.util.OptionalDouble;

/**
 * Simplifies an expression tree by folding constant sub-expressions and applying
 * the identities {@code x+0}, {@code 0+x}, {@code x-0}, {@code x*1}, {@code 1*x},
 * {@code x*0}, {@code 0*x} and {@code x/1}.
 * <p>
 * The input tree is never modified; folded nodes keep the span of the node they replace.
 * Identities only fire when the other operand simplifies to exactly 0 or 1.
 */
public class Simplifier implements AstNodeVisitor<AstNode> {

    private final Evaluator evaluator;

    /**
     * Creates a simplifier.
     * @param evaluator The evaluator used to fold constants.
     */
    public Simplifier(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Simplifies a tree.
     * @param node The root node.
     * @return The simplified tree; a single {@link NumberNode} if the whole tree folds.
     */
    public AstNode simplify(AstNode node) {
        EvalResult whole = evaluator.evaluate(node);
        if (whole instanceof EvalResult.Numeric numeric) {
            return new NumberNode(numeric.value(), node.span());
        }
        return node.accept(this);
    }

    @Override
    public AstNode visitNumber(NumberNode node) {
        return node;
    }

    @Override
    public AstNode visitVariable(VariableNode node) {
        return node;
    }

    @Override
    public AstNode visitUnary(UnaryNode node) {
        AstNode operand = simplify(node.operand());
        Double value = evaluator.tryEvaluate(operand);
        if (value != null) {
            return new NumberNode(-value, node.span());
        }
        return new UnaryNode(operand, node.span());
    }

    @Override
    public AstNode visitPower(PowerNode node) {
        AstNode base = simplify(node.base());
        Double value = evaluator.tryEvaluate(base);
        if (value != null) {
            OptionalDouble folded = Evaluator.power(value, node.exponent());
            if (folded.isPresent()) {
                return new NumberNode(folded.getAsDouble(), node.span());
            }
        }
        return new PowerNode(base, node.exponent(), node.span());
    }

    @Override
    public AstNode visitBinary(BinaryNode node) {
        AstNode left = simplify(node.left());
        AstNode right = simplify(node.right());
        Double leftValue = evaluator.tryEvaluate(left);
        Double rightValue = evaluator.tryEvaluate(right);
        BinaryOperator operator = node.operator();

        if (leftValue != null && rightValue != null) {
            OptionalDouble folded = Evaluator.apply(operator, leftValue, rightValue);
            if (folded.isPresent()) {
                return new NumberNode(folded.getAsDouble(), node.span());
            }
            return new BinaryNode(operator, left, right, node.span());
        }

        switch (operator) {
            case ADD:
                if (is(leftValue, 0)) return right;
                if (is(rightValue, 0)) return left;
                break;
            case SUBTRACT:
                if (is(rightValue, 0)) return left;
                break;
            case MULTIPLY:
                if (is(leftValue, 1)) return right;
                if (is(rightValue, 1)) return left;
                if (is(leftValue, 0) || is(rightValue, 0)) return new NumberNode(0, node.span());
                break;
            case DIVIDE:
                if (is(rightValue, 1)) return left;
                break;
        }
        return new BinaryNode(operator, left, right, node.span());
    }

    private static boolean is(Double value, double literal) {
        return value != null && value == literal;
    }
}
