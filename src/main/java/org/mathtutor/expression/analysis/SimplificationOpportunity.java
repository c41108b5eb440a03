package org.mathtutor.expression.analysis;

import org.mathtutor.expression.api.SourceSpan;

import java.util.List;

/**
 * A simplification the student could perform, located by source spans.
 * <p>
 * Spans refer to the source string of the side they were found on: numerator spans to
 * the numerator text, denominator spans to the denominator text.
 */
public sealed interface SimplificationOpportunity
        permits SimplificationOpportunity.CommonFactor,
                SimplificationOpportunity.LikeTerms,
                SimplificationOpportunity.ReducibleFraction {

    /**
     * A factor shared by numeric literals of a numerator and a denominator.
     *
     * @param factor The shared factor, always greater than one.
     * @param numeratorSpans The spans of the numerator literals divisible by the factor.
     * @param denominatorSpans The spans of the denominator literals divisible by the factor.
     */
    record CommonFactor(long factor, List<SourceSpan> numeratorSpans, List<SourceSpan> denominatorSpans)
            implements SimplificationOpportunity {
        public CommonFactor {
            numeratorSpans = List.copyOf(numeratorSpans);
            denominatorSpans = List.copyOf(denominatorSpans);
        }
    }

    /**
     * Terms of a sum that share a variable and an exponent.
     *
     * @param variable The shared variable, or {@code null} for constant terms.
     * @param exponent The shared exponent.
     * @param spans The spans of the terms, in source order.
     */
    record LikeTerms(String variable, double exponent, List<SourceSpan> spans)
            implements SimplificationOpportunity {
        public LikeTerms {
            spans = List.copyOf(spans);
        }

        /**
         * @return {@code true} if the grouped terms are plain constants.
         */
        public boolean isConstant() {
            return variable == null;
        }
    }

    /**
     * A literal fraction {@code a / b} whose terms share a divisor.
     *
     * @param gcd The greatest common divisor of both literals, always greater than one.
     * @param numeratorSpan The span of the numerator literal.
     * @param denominatorSpan The span of the denominator literal.
     */
    record ReducibleFraction(long gcd, SourceSpan numeratorSpan, SourceSpan denominatorSpan)
            implements SimplificationOpportunity {
    }
}
