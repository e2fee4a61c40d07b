package org.rpncompiler.compiler.frontend.semantics;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * Rejects token streams that can never execute.
 * <p>
 * Operand counts are deliberately not checked here; the generated code guards
 * every operation against the run-time stack depth instead.
 */
public final class ProgramShapeAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final String programName;

    /**
     * @param diagnostics The engine errors are reported to.
     * @param programName The program name for diagnostics.
     */
    public ProgramShapeAnalyzer(DiagnosticsEngine diagnostics, String programName) {
        this.diagnostics = diagnostics;
        this.programName = programName;
    }

    /**
     * Validates the shape of the program.
     * @param tokens The collected tokens, without the end-of-file marker.
     */
    public void analyze(List<Token> tokens) {
        if (tokens.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.EMPTY_PROGRAM,
                    "The input expression was empty", programName, 0);
            return;
        }

        Token first = tokens.get(0);
        if (first.type() != TokenType.NUMBER) {
            diagnostics.reportError(CompilerErrorCode.PROGRAM_MUST_START_WITH_NUMBER,
                    "Expected the program to begin with a number, found '" + first.text() + "'",
                    programName, first.column());
            return;
        }

        // A lone number is a valid program; the rule only applies to longer ones.
        Token last = tokens.get(tokens.size() - 1);
        if (tokens.size() > 1 && last.type() == TokenType.NUMBER) {
            diagnostics.reportError(CompilerErrorCode.PROGRAM_ENDS_WITH_NUMBER,
                    "Program ends with the number '" + last.text() + "', which nothing consumes",
                    programName, last.column());
        }
    }
}
