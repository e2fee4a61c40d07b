package org.rpncompiler.compiler.diagnostics;

import org.rpncompiler.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors reported during a compilation.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, IR generator, etc.).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code        The error code.
     * @param message     The error message.
     * @param programName The program in which the error occurred.
     * @param column      The column of the error.
     */
    public void reportError(CompilerErrorCode code, String message, String programName, int column) {
        diagnostics.add(new Diagnostic(code, message, programName, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the code of the first reported error.
     *
     * @return The first error code, or {@link CompilerErrorCode#UNKNOWN_ERROR} if there is none.
     */
    public CompilerErrorCode firstErrorCode() {
        return diagnostics.isEmpty() ? CompilerErrorCode.UNKNOWN_ERROR : diagnostics.get(0).code();
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
