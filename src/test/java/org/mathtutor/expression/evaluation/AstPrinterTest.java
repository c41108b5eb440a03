package org.mathtutor.expression.evaluation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.frontend.parser.ast.VariableNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link AstPrinter}.
 */
public class AstPrinterTest {

    private final ExpressionEngine engine = new ExpressionEngine();
    private final AstPrinter printer = new AstPrinter(2, true);

    /**
     * Verifies that parentheses are printed only where precedence or associativity needs them.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "2 + 3 * 4       | 2 + 3 × 4",
            "(2 + 3) * 4     | (2 + 3) × 4",
            "((2))           | 2",
            "10 - 5 - 2      | 10 - 5 - 2",
            "10 - (5 - 2)    | 10 - (5 - 2)",
            "10 - (5 + 2)    | 10 - (5 + 2)",
            "(10 - 5) + 2    | 10 - 5 + 2",
            "a / (b / c)     | a ÷ (b ÷ c)",
            "a / (b * c)     | a ÷ (b × c)",
            "a * (b / c)     | a × b ÷ c",
            "-(x + 1)        | -(x + 1)",
            "-x              | -x",
            "(x + 1)^2       | (x + 1)^2",
            "(-x)^3          | (-x)^3",
            "x^-1            | x^-1",
            "3x              | 3 × x"
    })
    void testPrint(String input, String expected) throws ParseException {
        assertThat(printer.print(engine.parse(input))).isEqualTo(expected);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "3, 3",
            "-4, -4",
            "2.5, 2.5",
            "0.333333, 0.33",
            "2.999, 3",
            "0.001, 0",
            "-0.001, 0",
            "-0.0, 0",
            "1.005, 1",
            "2.675, 2.67",
            "1e20, 100000000000000000000"
    })
    void testFormatNumber(double value, String expected) {
        assertThat(printer.formatNumber(value)).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testVariableCoefficients() {
        assertThat(printer.print(new VariableNode("x", 1, null))).isEqualTo("x");
        assertThat(printer.print(new VariableNode("x", -1, null))).isEqualTo("-x");
        assertThat(printer.print(new VariableNode("x", 3, null))).isEqualTo("3x");
        assertThat(printer.print(new VariableNode("y", 2.5, null))).isEqualTo("2.5y");
    }

    @Test
    @Tag("unit")
    void testAsciiOperatorsAndPrecision() throws ParseException {
        AstPrinter ascii = new AstPrinter(4, false);

        assertThat(ascii.print(engine.parse("a * b / c"))).isEqualTo("a * b / c");
        assertThat(ascii.formatNumber(1.0 / 3)).isEqualTo("0.3333");
    }

    @Test
    @Tag("unit")
    void testNegativeDecimalPlacesAreRejected() {
        assertThatThrownBy(() -> new AstPrinter(-1, true)).isInstanceOf(IllegalArgumentException.class);
    }
}
