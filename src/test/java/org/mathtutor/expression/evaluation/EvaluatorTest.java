package org.mathtutor.expression.evaluation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryOperator;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link Evaluator}.
 * Verifies folding of constant trees and that every non-computable node stays symbolic
 * instead of producing NaN or infinity.
 */
public class EvaluatorTest {

    private final ExpressionEngine engine = new ExpressionEngine();
    private final Evaluator evaluator = new Evaluator();

    private AstNode parse(String input) throws ParseException {
        return engine.parse(input);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "'2 + 3 * 4', 14",
            "'(2 + 3) * 4', 20",
            "'10 - 6 / 2', 7",
            "'10 - 5 - 2', 3",
            "'100 / 10 / 2', 5",
            "'--5', 5",
            "'2^10', 1024",
            "'2^-1', 0.5",
            "'-3^2', -9",
            "'(1 + 1)^', 4",
            "'.5 * 4', 2",
            "'6 ÷ 4', 1.5"
    })
    void testFoldsConstantExpressions(String input, double expected) throws ParseException {
        EvalResult result = evaluator.evaluate(parse(input));

        assertThat(result).isInstanceOf(EvalResult.Numeric.class);
        assertThat(((EvalResult.Numeric) result).value()).isCloseTo(expected, within(1e-12));
    }

    /**
     * Division by zero yields the division node itself, not a special value.
     */
    @Test
    @Tag("unit")
    void testDivisionByZeroStaysSymbolic() throws ParseException {
        // Arrange
        AstNode ast = parse("1 + 4 / (2 - 2)");

        // Act
        EvalResult result = evaluator.evaluate(ast);

        // Assert
        assertThat(result.isNumeric()).isFalse();
        assertThat(((EvalResult.Symbolic) result).node()).isEqualTo(ast);
        assertThat(evaluator.tryEvaluate(ast)).isNull();
    }

    @Test
    @Tag("unit")
    void testZeroToNegativePowerStaysSymbolic() throws ParseException {
        assertThat(evaluator.tryEvaluate(parse("0^-1"))).isNull();
    }

    @Test
    @Tag("unit")
    void testVariablesStaySymbolic() throws ParseException {
        AstNode ast = parse("3x + 1");

        assertThat(evaluator.evaluate(ast)).isEqualTo(new EvalResult.Symbolic(ast));
        assertThat(evaluator.tryEvaluate(ast)).isNull();
    }

    @Test
    @Tag("unit")
    void testNonFiniteLiteralStaysSymbolic() {
        NumberNode huge = new NumberNode(Double.POSITIVE_INFINITY);

        assertThat(evaluator.evaluate(huge)).isEqualTo(new EvalResult.Symbolic(huge));
    }

    @Test
    @Tag("unit")
    void testTryEvaluateNull() {
        assertThat(evaluator.tryEvaluate(null)).isNull();
    }

    @Test
    @Tag("unit")
    void testApply() {
        assertThat(Evaluator.apply(BinaryOperator.SUBTRACT, 7, 10).getAsDouble()).isEqualTo(-3.0);
        assertThat(Evaluator.apply(BinaryOperator.DIVIDE, 1, 0)).isEmpty();
        assertThat(Evaluator.apply(BinaryOperator.MULTIPLY, Double.MAX_VALUE, 2)).isEmpty();
        assertThat(Evaluator.power(10, 400)).isEmpty();
    }
}
