package org.rpncompiler.compiler.diagnostics;

import org.rpncompiler.compiler.api.CompilerErrorCode;

/**
 * A single compile error.
 *
 * @param code The error code.
 * @param message The diagnostic message.
 * @param programName The name of the program where the issue occurred.
 * @param column The column of the issue, or 0 if it concerns the whole expression.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        String programName,
        int column
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d: %s", programName, column, message);
    }
}
