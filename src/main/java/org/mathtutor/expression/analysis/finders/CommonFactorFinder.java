package org.mathtutor.expression.analysis.finders;

import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.analysis.SimplificationOpportunity.CommonFactor;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.frontend.TreeWalker;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds numeric factors shared by the literals of a numerator and a denominator.
 * <p>
 * Nothing is reported unless both sides contain a non-zero integral literal. The first
 * pass reports the greatest common divisor of all integral literals on both sides. The
 * second pass reports, for each integral denominator literal, the numerator literals it
 * divides, unless a factor of the same size was already reported.
 */
public class CommonFactorFinder {

    /**
     * Searches a fraction for common factors.
     * @param numerator The numerator tree, never {@code null}.
     * @param denominator The denominator tree, never {@code null}.
     * @param opportunities The list to append found opportunities to.
     */
    public void find(AstNode numerator, AstNode denominator, List<SimplificationOpportunity> opportunities) {
        List<NumberNode> numeratorLiterals = collectLiterals(numerator);
        List<NumberNode> denominatorLiterals = collectLiterals(denominator);

        long numeratorGcd = gcdOf(numeratorLiterals);
        long denominatorGcd = gcdOf(denominatorLiterals);
        // Both sides need a non-zero integral literal, otherwise nothing can be cancelled.
        if (numeratorGcd == 0 || denominatorGcd == 0) {
            return;
        }

        findGreatestCommonFactor(IntegerMath.gcd(numeratorGcd, denominatorGcd),
                numeratorLiterals, denominatorLiterals, opportunities);
        findDenominatorFactors(numeratorLiterals, denominatorLiterals, opportunities);
    }

    private void findGreatestCommonFactor(long gcd, List<NumberNode> numeratorLiterals,
                                          List<NumberNode> denominatorLiterals,
                                          List<SimplificationOpportunity> opportunities) {
        if (gcd <= 1) {
            return;
        }
        List<SourceSpan> numeratorSpans = spansOfMultiples(numeratorLiterals, gcd);
        List<SourceSpan> denominatorSpans = spansOfMultiples(denominatorLiterals, gcd);
        if (!numeratorSpans.isEmpty() && !denominatorSpans.isEmpty()) {
            opportunities.add(new CommonFactor(gcd, numeratorSpans, denominatorSpans));
        }
    }

    private void findDenominatorFactors(List<NumberNode> numeratorLiterals, List<NumberNode> denominatorLiterals,
                                        List<SimplificationOpportunity> opportunities) {
        for (NumberNode literal : denominatorLiterals) {
            if (!IntegerMath.isIntegral(literal) || literal.value() == 0 || literal.value() == 1) {
                continue;
            }
            long factor = Math.abs((long) literal.value());
            if (factor <= 1 || isReported(factor, opportunities)) {
                continue;
            }
            List<SourceSpan> numeratorSpans = spansOfMultiples(numeratorLiterals, factor);
            if (!numeratorSpans.isEmpty() && literal.hasSpan()) {
                opportunities.add(new CommonFactor(factor, numeratorSpans, List.of(literal.span())));
            }
        }
    }

    private static boolean isReported(long factor, List<SimplificationOpportunity> opportunities) {
        for (SimplificationOpportunity opportunity : opportunities) {
            if (opportunity instanceof CommonFactor common && common.factor() == factor) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The gcd of all non-zero integral literals, or 0 if there are none.
     */
    private static long gcdOf(List<NumberNode> literals) {
        long gcd = 0;
        for (NumberNode literal : literals) {
            if (IntegerMath.isIntegral(literal) && literal.value() != 0) {
                gcd = IntegerMath.gcd(gcd, (long) literal.value());
            }
        }
        return gcd;
    }

    private static List<SourceSpan> spansOfMultiples(List<NumberNode> literals, long divisor) {
        List<SourceSpan> spans = new ArrayList<>();
        for (NumberNode literal : literals) {
            if (literal.hasSpan() && IntegerMath.isMultipleOf(literal, divisor)) {
                spans.add(literal.span());
            }
        }
        return spans;
    }

    private static List<NumberNode> collectLiterals(AstNode root) {
        List<NumberNode> literals = new ArrayList<>();
        new TreeWalker(Map.of(NumberNode.class, node -> literals.add((NumberNode) node))).walk(root);
        return literals;
    }
}
