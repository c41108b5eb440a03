package org.mathtutor.expression.analysis.finders;

import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.analysis.SimplificationOpportunity.LikeTerms;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryOperator;
import org.mathtutor.expression.frontend.parser.ast.PowerNode;
import org.mathtutor.expression.frontend.parser.ast.UnaryNode;
import org.mathtutor.expression.frontend.parser.ast.VariableNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds terms of a top-level sum that could be combined, e.g. {@code 3x} and {@code 2x}
 * in {@code 3x + 2x}, or the constants in {@code 2 + x + 5}.
 * <p>
 * A term is reduced to its signature: the last variable found in its product chain and
 * the exponent of the last power. Division contributes only its dividend. Groups are
 * reported in the order their first term appears.
 */
public class LikeTermsFinder implements IOpportunityFinder {

    /**
     * The part of a term that decides whether it can be combined with another.
     */
    record Signature(String variable, double exponent) {}

    @Override
    public void find(AstNode root, List<SimplificationOpportunity> opportunities) {
        List<AstNode> terms = new ArrayList<>();
        collectTerms(root, terms);

        Map<Signature, List<AstNode>> groups = new LinkedHashMap<>();
        for (AstNode term : terms) {
            groups.computeIfAbsent(signatureOf(term), k -> new ArrayList<>()).add(term);
        }

        groups.forEach((signature, members) -> {
            if (members.size() < 2) {
                return;
            }
            List<SourceSpan> spans = new ArrayList<>();
            for (AstNode member : members) {
                if (member.hasSpan()) {
                    spans.add(member.span());
                }
            }
            opportunities.add(new LikeTerms(signature.variable(), signature.exponent(), spans));
        });
    }

    private void collectTerms(AstNode node, List<AstNode> terms) {
        if (node instanceof BinaryNode binary && binary.operator().isAdditive()) {
            collectTerms(binary.left(), terms);
            collectTerms(binary.right(), terms);
        } else {
            terms.add(node);
        }
    }

    static Signature signatureOf(AstNode term) {
        SignatureBuilder builder = new SignatureBuilder();
        builder.visit(term);
        return new Signature(builder.variable, builder.exponent);
    }

    private static final class SignatureBuilder {
        private String variable;
        private double exponent = 1;

        void visit(AstNode node) {
            if (node instanceof VariableNode variableNode) {
                variable = variableNode.name();
            } else if (node instanceof UnaryNode unary) {
                visit(unary.operand());
            } else if (node instanceof PowerNode power) {
                visit(power.base());
                exponent = power.exponent();
            } else if (node instanceof BinaryNode binary) {
                if (binary.operator() == BinaryOperator.MULTIPLY) {
                    visit(binary.left());
                    visit(binary.right());
                } else if (binary.operator() == BinaryOperator.DIVIDE) {
                    visit(binary.left());
                }
            }
            // Numeric literals only scale the coefficient and leave the signature alone.
        }
    }
}
