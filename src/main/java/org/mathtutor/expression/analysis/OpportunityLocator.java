package org.mathtutor.expression.analysis;

import org.mathtutor.expression.analysis.SimplificationOpportunity.CommonFactor;
import org.mathtutor.expression.analysis.SimplificationOpportunity.LikeTerms;
import org.mathtutor.expression.analysis.SimplificationOpportunity.ReducibleFraction;
import org.mathtutor.expression.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps source locations back to the opportunities that cover them, so that a renderer
 * can highlight the characters a student could simplify.
 */
public final class OpportunityLocator {

    private OpportunityLocator() {}

    /**
     * @param span The location to test, may be {@code null}.
     * @param opportunities The opportunities of the exercise.
     * @param part The part of the exercise the location belongs to.
     * @return {@code true} if any opportunity covers the location.
     */
    public static boolean isSpanHighlighted(SourceSpan span, List<SimplificationOpportunity> opportunities,
                                            PartType part) {
        return !getOpportunitiesAtSpan(span, opportunities, part).isEmpty();
    }

    /**
     * @param span The location to test, may be {@code null}.
     * @param opportunities The opportunities of the exercise.
     * @param part The part of the exercise the location belongs to.
     * @return The opportunities covering the location, in their original order.
     */
    public static List<SimplificationOpportunity> getOpportunitiesAtSpan(
            SourceSpan span, List<SimplificationOpportunity> opportunities, PartType part) {
        if (span == null || opportunities == null || opportunities.isEmpty()) {
            return Collections.emptyList();
        }
        List<SimplificationOpportunity> matches = new ArrayList<>();
        for (SimplificationOpportunity opportunity : opportunities) {
            if (spansFor(opportunity, part).stream().anyMatch(span::overlaps)) {
                matches.add(opportunity);
            }
        }
        return matches;
    }

    /**
     * Selects the spans of an opportunity that live in the given part.
     */
    static List<SourceSpan> spansFor(SimplificationOpportunity opportunity, PartType part) {
        if (opportunity instanceof CommonFactor common) {
            return part == PartType.DENOMINATOR ? common.denominatorSpans() : common.numeratorSpans();
        }
        if (opportunity instanceof LikeTerms likeTerms) {
            return likeTerms.spans();
        }
        ReducibleFraction fraction = (ReducibleFraction) opportunity;
        SourceSpan selected = switch (part) {
            case NUMERATOR -> fraction.numeratorSpan();
            case DENOMINATOR -> fraction.denominatorSpan();
            case EXPRESSION -> null;
        };
        return selected == null ? Collections.emptyList() : List.of(selected);
    }
}
