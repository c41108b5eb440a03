package org.mathtutor.expression.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void testCollectsDiagnosticsInOrder() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        diagnostics.reportWarning("Skipped unrecognized character '?'", 1);
        diagnostics.reportError("Unexpected token: end of input", 3);

        // Assert
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        assertThat(diagnostics.summary()).isEqualTo(
                "[WARNING] @1: Skipped unrecognized character '?'\n[ERROR] @3: Unexpected token: end of input");
    }

    @Test
    @Tag("unit")
    void testDiagnosticsViewIsReadOnly() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThatThrownBy(() -> diagnostics.getDiagnostics().add(new Diagnostic(Diagnostic.Type.INFO, "x", 0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
