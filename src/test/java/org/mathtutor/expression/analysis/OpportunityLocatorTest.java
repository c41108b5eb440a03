package org.mathtutor.expression.analysis;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mathtutor.expression.analysis.SimplificationOpportunity.CommonFactor;
import org.mathtutor.expression.analysis.SimplificationOpportunity.LikeTerms;
import org.mathtutor.expression.analysis.SimplificationOpportunity.ReducibleFraction;
import org.mathtutor.expression.api.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link OpportunityLocator}.
 */
public class OpportunityLocatorTest {

    private final CommonFactor commonFactor =
            new CommonFactor(2, List.of(new SourceSpan(0, 1)), List.of(new SourceSpan(4, 5)));
    private final LikeTerms likeTerms = new LikeTerms("x", 1, List.of(new SourceSpan(6, 8)));
    private final ReducibleFraction fraction = new ReducibleFraction(3, new SourceSpan(10, 11), new SourceSpan(12, 14));
    private final List<SimplificationOpportunity> all = List.of(commonFactor, likeTerms, fraction);

    /**
     * Common factors use the denominator spans only for the denominator part.
     */
    @Test
    @Tag("unit")
    void testCommonFactorSpansPerPart() {
        assertThat(OpportunityLocator.isSpanHighlighted(new SourceSpan(0, 1), all, PartType.NUMERATOR)).isTrue();
        assertThat(OpportunityLocator.isSpanHighlighted(new SourceSpan(0, 1), all, PartType.EXPRESSION)).isTrue();
        assertThat(OpportunityLocator.isSpanHighlighted(new SourceSpan(0, 1), all, PartType.DENOMINATOR)).isFalse();
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(4, 5), all, PartType.DENOMINATOR))
                .containsExactly(commonFactor);
    }

    @Test
    @Tag("unit")
    void testLikeTermsMatchEveryPart() {
        for (PartType part : PartType.values()) {
            assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(7, 9), all, part))
                    .containsExactly(likeTerms);
        }
    }

    /**
     * A reducible fraction has no spans in a standalone expression part.
     */
    @Test
    @Tag("unit")
    void testReducibleFractionSpansPerPart() {
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(10, 11), all, PartType.NUMERATOR))
                .containsExactly(fraction);
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(13, 14), all, PartType.DENOMINATOR))
                .containsExactly(fraction);
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(10, 14), all, PartType.EXPRESSION))
                .isEmpty();
        assertThat(OpportunityLocator.isSpanHighlighted(new SourceSpan(10, 11), all, PartType.DENOMINATOR)).isFalse();
    }

    @Test
    @Tag("unit")
    void testOverlapIsHalfOpen() {
        assertThat(OpportunityLocator.isSpanHighlighted(new SourceSpan(1, 4), all, PartType.NUMERATOR)).isFalse();
        assertThat(OpportunityLocator.isSpanHighlighted(SourceSpan.at(0), all, PartType.NUMERATOR)).isFalse();
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(0, 20), all, PartType.NUMERATOR))
                .containsExactly(commonFactor, likeTerms, fraction);
    }

    @Test
    @Tag("unit")
    void testMissingInputs() {
        assertThat(OpportunityLocator.isSpanHighlighted(null, all, PartType.NUMERATOR)).isFalse();
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(0, 1), null, PartType.NUMERATOR)).isEmpty();
        assertThat(OpportunityLocator.getOpportunitiesAtSpan(new SourceSpan(0, 1), List.of(), PartType.NUMERATOR)).isEmpty();
    }
}
