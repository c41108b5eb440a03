package org.mathtutor.expression.analysis.finders;

import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Interface for the finders run over a single expression.
 * Each finder looks for one kind of {@link SimplificationOpportunity}.
 */
@FunctionalInterface
public interface IOpportunityFinder {
    /**
     * Searches an expression tree for opportunities.
     * @param root The root of the tree, never {@code null}.
     * @param opportunities The list to append found opportunities to.
     */
    void find(AstNode root, List<SimplificationOpportunity> opportunities);
}
