package org.rpncompiler.compiler.frontend.semantics;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.lexer.Lexer;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ProgramShapeAnalyzerTest {

    private DiagnosticsEngine analyze(String expression) {
        List<Token> tokens = new Lexer(expression).scanTokens().stream()
                .filter(t -> t.type() != TokenType.END_OF_FILE)
                .collect(Collectors.toList());
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new ProgramShapeAnalyzer(diagnostics, "TestProg").analyze(tokens);
        return diagnostics;
    }

    @Test
    void rejectsEmptyProgram() {
        assertThat(analyze("   ").firstErrorCode()).isEqualTo(CompilerErrorCode.EMPTY_PROGRAM);
    }

    @Test
    void rejectsProgramNotStartingWithNumber() {
        DiagnosticsEngine diagnostics = analyze("+");

        assertThat(diagnostics.firstErrorCode()).isEqualTo(CompilerErrorCode.PROGRAM_MUST_START_WITH_NUMBER);
        assertThat(diagnostics.summary().lines().count()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"3 3", "3 4 + 3"})
    void rejectsTrailingNumber(String expression) {
        assertThat(analyze(expression).firstErrorCode()).isEqualTo(CompilerErrorCode.PROGRAM_ENDS_WITH_NUMBER);
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "-1.5", "3 4 +", "4 +", "3 3 3 +", "3 0 /"})
    void acceptsStructurallyValidPrograms(String expression) {
        assertThat(analyze(expression).hasErrors()).isFalse();
    }
}
