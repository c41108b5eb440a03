package org.mathtutor.expression;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mathtutor.expression.analysis.PartType;
import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.frontend.lexer.TokenType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the static {@link Expressions} entry points.
 */
public class ExpressionsTest {

    @Test
    @Tag("unit")
    void testStaticEntryPointsUseDefaultOptions() throws ParseException {
        assertThat(Expressions.tokenize("x").get(1).type()).isEqualTo(TokenType.EOF);
        assertThat(Expressions.evaluateString("2^")).isEqualTo(4.0);
        assertThat(Expressions.simplifyString("6 * x / 1")).isEqualTo("6 × x");
        assertThat(Expressions.astToString(Expressions.simplify(Expressions.parse("2 + 2")))).isEqualTo("4");
        assertThat(Expressions.tryParse(")")).isNull();
        assertThat(Expressions.tryEvaluate(Expressions.tryParse("9 / 3"))).isEqualTo(3.0);
        assertThat(Expressions.evaluate(Expressions.parse("1")).isNumeric()).isTrue();
    }

    @Test
    @Tag("unit")
    void testStaticAnalysisAndLocation() throws ParseException {
        List<SimplificationOpportunity> opportunities =
                Expressions.analyzeFraction(Expressions.parse("8 + x + x"), Expressions.parse("4"));

        assertThat(opportunities).hasSize(2);
        assertThat(Expressions.isSpanHighlighted(new SourceSpan(0, 1), opportunities, PartType.NUMERATOR)).isTrue();
        assertThat(Expressions.getOpportunitiesAtSpan(new SourceSpan(0, 1), opportunities, PartType.DENOMINATOR))
                .hasSize(1);
        assertThat(Expressions.analyzeExpression(Expressions.parse("x + x"))).hasSize(1);
    }
}
