package org.mathtutor.expression.evaluation;

import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.AstNodeVisitor;
import org.mathtutor.expression.frontend.parser.ast.BinaryNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryOperator;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;
import org.mathtutor.expression.frontend.parser.ast.PowerNode;
import org.mathtutor.expression.frontend.parser.ast.UnaryNode;
import org.mathtutor.expression.frontend.parser.ast.VariableNode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders an expression tree as display text with as few parentheses as possible.
 * <p>
 * Whole numbers print without decimals, other numbers are rounded to a fixed number of
 * decimal places with trailing zeros removed. The right operand of {@code -} and {@code /}
 * is parenthesized even at equal precedence, so {@code a - (b - c)} stays distinguishable
 * from {@code a - b - c}.
 */
public class AstPrinter implements AstNodeVisitor<String> {

    private final int decimalPlaces;
    private final boolean unicodeOperators;

    /**
     * Creates a printer.
     * @param decimalPlaces The number of decimal places for non-integral values.
     * @param unicodeOperators {@code true} to print {@code ×} and {@code ÷} instead of {@code *} and {@code /}.
     */
    public AstPrinter(int decimalPlaces, boolean unicodeOperators) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative: " + decimalPlaces);
        }
        this.decimalPlaces = decimalPlaces;
        this.unicodeOperators = unicodeOperators;
    }

    /**
     * Renders a tree.
     * @param node The root node.
     * @return The display text.
     */
    public String print(AstNode node) {
        return node.accept(this);
    }

    /**
     * Formats a number the way literals are displayed.
     * @param value The value.
     * @return {@code "3"} for 3.0, {@code "2.5"} for 2.5, {@code "0.33"} for 1/3 at two decimal places.
     */
    public String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value)) {
            return new BigDecimal(value).toPlainString();
        }
        String text = new BigDecimal(value)
                .setScale(decimalPlaces, RoundingMode.HALF_UP)
                .toPlainString();
        if (text.indexOf('.') >= 0) {
            text = text.replaceAll("0+$", "");
            if (text.endsWith(".")) {
                text = text.substring(0, text.length() - 1);
            }
        }
        return "-0".equals(text) ? "0" : text;
    }

    @Override
    public String visitNumber(NumberNode node) {
        return formatNumber(node.value());
    }

    @Override
    public String visitVariable(VariableNode node) {
        if (node.coefficient() == 1) {
            return node.name();
        }
        if (node.coefficient() == -1) {
            return "-" + node.name();
        }
        return formatNumber(node.coefficient()) + node.name();
    }

    @Override
    public String visitUnary(UnaryNode node) {
        String operand = print(node.operand());
        if (node.operand() instanceof BinaryNode) {
            return "-(" + operand + ")";
        }
        return "-" + operand;
    }

    @Override
    public String visitPower(PowerNode node) {
        String base = print(node.base());
        if (node.base() instanceof BinaryNode || node.base() instanceof UnaryNode) {
            base = "(" + base + ")";
        }
        return base + "^" + formatNumber(node.exponent());
    }

    @Override
    public String visitBinary(BinaryNode node) {
        String left = print(node.left());
        String right = print(node.right());
        if (needsParens(node.left(), node.operator(), false)) {
            left = "(" + left + ")";
        }
        if (needsParens(node.right(), node.operator(), true)) {
            right = "(" + right + ")";
        }
        return left + " " + symbol(node.operator()) + " " + right;
    }

    private String symbol(BinaryOperator operator) {
        if (!unicodeOperators) {
            return String.valueOf(operator.symbol());
        }
        return switch (operator) {
            case MULTIPLY -> "×";
            case DIVIDE -> "÷";
            default -> String.valueOf(operator.symbol());
        };
    }

    private static boolean needsParens(AstNode child, BinaryOperator parent, boolean rightSide) {
        if (!(child instanceof BinaryNode binary)) {
            return false;
        }
        int childPrecedence = binary.operator().precedence();
        if (childPrecedence < parent.precedence()) {
            return true;
        }
        // a - (b - c) and a / (b / c) are not left-associative chains.
        return rightSide
                && (parent == BinaryOperator.SUBTRACT || parent == BinaryOperator.DIVIDE)
                && childPrecedence == parent.precedence();
    }
}
