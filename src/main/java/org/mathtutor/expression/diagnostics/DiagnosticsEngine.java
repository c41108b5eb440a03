package org.mathtutor.expression.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages (errors, warnings) of a single tokenize or parse call.
 * <p>
 * This decouples error reporting from the lexer and parser logic. An engine belongs to
 * exactly one call and must not be shared between threads.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message  The error message.
     * @param position The character offset of the error.
     */
    public void reportError(String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, position));
    }

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param position The character offset of the warning.
     */
    public void reportWarning(String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, position));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
