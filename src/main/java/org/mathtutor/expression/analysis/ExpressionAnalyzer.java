package org.mathtutor.expression.analysis;

import org.mathtutor.expression.analysis.finders.CommonFactorFinder;
import org.mathtutor.expression.analysis.finders.IOpportunityFinder;
import org.mathtutor.expression.analysis.finders.LikeTermsFinder;
import org.mathtutor.expression.analysis.finders.ReducibleFractionFinder;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detects simplification opportunities in parsed expressions and fractions.
 * Analysis never fails: a {@code null} input yields an empty list.
 */
public class ExpressionAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionAnalyzer.class);

    private final List<IOpportunityFinder> expressionFinders;
    private final CommonFactorFinder commonFactorFinder;

    /**
     * Constructs an analyzer with the like-terms and reducible-fraction finders.
     */
    public ExpressionAnalyzer() {
        this.expressionFinders = List.of(new LikeTermsFinder(), new ReducibleFractionFinder());
        this.commonFactorFinder = new CommonFactorFinder();
    }

    /**
     * Finds like terms and reducible literal fractions in a single expression.
     * @param node The expression, may be {@code null}.
     * @return The opportunities, like terms first.
     */
    public List<SimplificationOpportunity> analyzeExpression(AstNode node) {
        if (node == null) {
            return Collections.emptyList();
        }
        List<SimplificationOpportunity> opportunities = new ArrayList<>();
        for (IOpportunityFinder finder : expressionFinders) {
            finder.find(node, opportunities);
        }
        LOG.debug("Found {} opportunities in expression", opportunities.size());
        return opportunities;
    }

    /**
     * Finds common factors between a numerator and a denominator, followed by the
     * opportunities of each side on its own.
     *
     * @param numerator The numerator, may be {@code null}.
     * @param denominator The denominator, may be {@code null}.
     * @return The opportunities; empty if either side is missing.
     */
    public List<SimplificationOpportunity> analyzeFraction(AstNode numerator, AstNode denominator) {
        if (numerator == null || denominator == null) {
            return Collections.emptyList();
        }
        List<SimplificationOpportunity> opportunities = new ArrayList<>();
        commonFactorFinder.find(numerator, denominator, opportunities);
        opportunities.addAll(analyzeExpression(numerator));
        opportunities.addAll(analyzeExpression(denominator));
        LOG.debug("Found {} opportunities in fraction", opportunities.size());
        return opportunities;
    }
}
