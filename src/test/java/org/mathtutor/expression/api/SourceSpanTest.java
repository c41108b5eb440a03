package org.mathtutor.expression.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SourceSpan}.
 */
public class SourceSpanTest {

    @Test
    @Tag("unit")
    void testOverlapIsHalfOpen() {
        SourceSpan span = new SourceSpan(2, 5);

        assertThat(span.overlaps(new SourceSpan(4, 6))).isTrue();
        assertThat(span.overlaps(new SourceSpan(0, 3))).isTrue();
        assertThat(span.overlaps(new SourceSpan(5, 6))).isFalse();
        assertThat(span.overlaps(new SourceSpan(0, 2))).isFalse();
        assertThat(span.overlaps(SourceSpan.at(3))).isFalse();
    }

    @Test
    @Tag("unit")
    void testLengthAndZeroWidth() {
        assertThat(new SourceSpan(1, 4).length()).isEqualTo(3);
        assertThat(new SourceSpan(1, 4).isEmpty()).isFalse();
        assertThat(SourceSpan.at(2).length()).isZero();
        assertThat(SourceSpan.at(2).isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void testRejectsInvalidOffsets() {
        assertThatThrownBy(() -> new SourceSpan(3, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceSpan(-1, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
