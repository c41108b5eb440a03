package org.mathtutor.expression.analysis.finders;

import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.analysis.SimplificationOpportunity.ReducibleFraction;
import org.mathtutor.expression.frontend.TreeWalker;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.AstNodes;
import org.mathtutor.expression.frontend.parser.ast.BinaryNode;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;

import java.util.List;
import java.util.Map;

/**
 * Finds every literal fraction {@code a / b} in a tree whose numerator and denominator
 * share a divisor greater than one, e.g. {@code 6 / 4}.
 */
public class ReducibleFractionFinder implements IOpportunityFinder {

    @Override
    public void find(AstNode root, List<SimplificationOpportunity> opportunities) {
        TreeWalker walker = new TreeWalker(Map.of(BinaryNode.class, node -> {
            if (!AstNodes.isLiteralFraction(node)) {
                return;
            }
            BinaryNode fraction = (BinaryNode) node;
            NumberNode numerator = (NumberNode) fraction.left();
            NumberNode denominator = (NumberNode) fraction.right();
            if (!IntegerMath.isIntegral(numerator) || !IntegerMath.isIntegral(denominator)
                    || denominator.value() == 0) {
                return;
            }
            long gcd = IntegerMath.gcd((long) numerator.value(), (long) denominator.value());
            if (gcd > 1) {
                opportunities.add(new ReducibleFraction(gcd, numerator.span(), denominator.span()));
            }
        }));
        walker.walk(root);
    }
}
