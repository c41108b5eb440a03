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
 * Evaluates an expression tree bottom-up.
 * <p>
 * Evaluation never fails. Variables, divisions by zero and any computation that does
 * not produce a finite double leave the affected node {@link EvalResult.Symbolic}.
 * The evaluator is stateless and may be shared between threads.
 */
public class Evaluator implements AstNodeVisitor<EvalResult> {

    /**
     * Evaluates a node.
     * @param node The node to evaluate.
     * @return The numeric value, or the node itself if it cannot be folded.
     */
    public EvalResult evaluate(AstNode node) {
        return node.accept(this);
    }

    /**
     * Evaluates a node to a number if possible.
     * @param node The node to evaluate, may be {@code null}.
     * @return The value, or {@code null} if the node is symbolic.
     */
    public Double tryEvaluate(AstNode node) {
        if (node == null) return null;
        EvalResult result = evaluate(node);
        return result instanceof EvalResult.Numeric numeric ? numeric.value() : null;
    }

    /**
     * Applies a binary operator to two values.
     * @param operator The operator.
     * @param left The left operand.
     * @param right The right operand.
     * @return The result, or empty for a division by zero or a non-finite result.
     */
    public static OptionalDouble apply(BinaryOperator operator, double left, double right) {
        double result = switch (operator) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0) {
                    yield Double.NaN;
                }
                yield left / right;
            }
        };
        return finite(result);
    }

    /**
     * Raises a value to an exponent.
     * @param base The base.
     * @param exponent The exponent.
     * @return The result, or empty if it is not finite (e.g. {@code 0^-1}).
     */
    public static OptionalDouble power(double base, double exponent) {
        return finite(Math.pow(base, exponent));
    }

    @Override
    public EvalResult visitNumber(NumberNode node) {
        return Double.isFinite(node.value()) ? new EvalResult.Numeric(node.value()) : new EvalResult.Symbolic(node);
    }

    @Override
    public EvalResult visitVariable(VariableNode node) {
        return new EvalResult.Symbolic(node);
    }

    @Override
    public EvalResult visitBinary(BinaryNode node) {
        EvalResult left = evaluate(node.left());
        EvalResult right = evaluate(node.right());
        if (left instanceof EvalResult.Numeric l && right instanceof EvalResult.Numeric r) {
            return toResult(apply(node.operator(), l.value(), r.value()), node);
        }
        return new EvalResult.Symbolic(node);
    }

    @Override
    public EvalResult visitUnary(UnaryNode node) {
        EvalResult operand = evaluate(node.operand());
        if (operand instanceof EvalResult.Numeric numeric) {
            return new EvalResult.Numeric(-numeric.value());
        }
        return new EvalResult.Symbolic(node);
    }

    @Override
    public EvalResult visitPower(PowerNode node) {
        EvalResult base = evaluate(node.base());
        if (base instanceof EvalResult.Numeric numeric) {
            return toResult(power(numeric.value(), node.exponent()), node);
        }
        return new EvalResult.Symbolic(node);
    }

    private static EvalResult toResult(OptionalDouble value, AstNode node) {
        return value.isPresent() ? new EvalResult.Numeric(value.getAsDouble()) : new EvalResult.Symbolic(node);
    }

    private static OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
