package org.mathtutor.expression.frontend.parser.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.api.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the shape predicates in {@link AstNodes} and span handling of the nodes.
 */
public class AstNodesTest {

    private final ExpressionEngine engine = new ExpressionEngine();

    @Test
    @Tag("unit")
    void testShapePredicates() throws ParseException {
        AstNode sum = engine.parse("x - 1");
        AstNode product = engine.parse("2 * x");
        AstNode fraction = engine.parse("6 / 4");

        assertThat(AstNodes.isAdditive(sum)).isTrue();
        assertThat(AstNodes.isAdditive(product)).isFalse();
        assertThat(AstNodes.isMultiplicative(product)).isTrue();
        assertThat(AstNodes.isMultiplicative(fraction)).isTrue();
        assertThat(AstNodes.isFraction(fraction)).isTrue();
        assertThat(AstNodes.isFraction(product)).isFalse();
        assertThat(AstNodes.isLiteralFraction(fraction)).isTrue();
        assertThat(AstNodes.isLiteralFraction(engine.parse("x / 4"))).isFalse();
        assertThat(AstNodes.isAdditive(new NumberNode(1))).isFalse();
    }

    @Test
    @Tag("unit")
    void testSpansAreOptional() {
        NumberNode bare = new NumberNode(2.5);

        assertThat(bare.hasSpan()).isFalse();
        assertThat(bare.isInteger()).isFalse();
        NumberNode located = bare.withSpan(new SourceSpan(0, 3));
        assertThat(located.hasSpan()).isTrue();
        assertThat(located.value()).isEqualTo(2.5);
        assertThat(new VariableNode("x", null).coefficient()).isEqualTo(1.0);
    }
}
