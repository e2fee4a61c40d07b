package org.rpncompiler.compiler.diagnostics;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @AfterEach
    void tearDown() {
        CompilerLogger.setVerbosity(CompilerLogger.NORMAL);
    }

    @Test
    void firstErrorDeterminesTheCode() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.firstErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_ERROR);

        diagnostics.reportError(CompilerErrorCode.UNKNOWN_TOKEN, "Unknown token $", "Prog", 5);
        diagnostics.reportError(CompilerErrorCode.EMPTY_PROGRAM, "empty", "Prog", 0);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.firstErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_TOKEN);
        assertThat(diagnostics.summary()).isEqualTo("[ERROR] Prog:5: Unknown token $\n[ERROR] Prog:0: empty");
    }

    @Test
    void verbosityIsClamped() {
        CompilerLogger.setVerbosity(42);
        assertThat(CompilerLogger.verbosity()).isEqualTo(CompilerLogger.TRACE);

        CompilerLogger.setVerbosity(-3);
        assertThat(CompilerLogger.verbosity()).isEqualTo(CompilerLogger.QUIET);
    }
}
