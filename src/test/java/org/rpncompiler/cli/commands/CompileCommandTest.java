package org.rpncompiler.cli.commands;

import org.rpncompiler.cli.CommandLineInterface;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.rpncompiler.cli.config.LoggingConfigurator;
import org.rpncompiler.compiler.diagnostics.CompilerLogger;
import org.rpncompiler.toolchain.ExecutionResult;
import org.rpncompiler.toolchain.IToolchain;
import org.rpncompiler.toolchain.ToolchainException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CompileCommandTest {

    @Mock
    private IToolchain toolchain;

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        commandLine = new CommandLine(new CommandLineInterface(config -> toolchain));
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        CompilerLogger.setVerbosity(CompilerLogger.NORMAL);
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger("org.rpncompiler.compiler").setLevel(null);
    }

    @Test
    void printsAssemblyByDefault() throws Exception {
        int exitCode = commandLine.execute("compile", "3 4 +");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains(".intel_syntax noprefix", "main:", "fadd");
        verify(toolchain, never()).assemble(anyString(), any());
    }

    @Test
    void reportsCompileErrors() {
        int exitCode = commandLine.execute("compile", "3 5 $");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error compiling: ").contains("Unknown token $");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void debugOptionInsertsBreakpoint() {
        commandLine.execute("compile", "--debug", "3 4 +");

        assertThat(out.toString()).contains("int3");
    }

    @Test
    void repeatedVerboseRaisesCompilerLogging() {
        int exitCode = commandLine.execute("compile", "-vv", "3 4 +");

        assertThat(exitCode).isZero();
        assertThat(CompilerLogger.verbosity()).isEqualTo(CompilerLogger.TRACE);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getLogger("org.rpncompiler.compiler").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void emitWritesAssemblyToFileOnly() throws Exception {
        Path asm = tempDir.resolve("prog.s");

        int exitCode = commandLine.execute("compile", "--emit", asm.toString(), "2 8 ^");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(asm)).contains("power_loop_2:");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void assembleUsesOutputOption() throws Exception {
        Path exe = tempDir.resolve("calc");

        int exitCode = commandLine.execute("compile", "--assemble", "-o", exe.toString(), "3 4 +");

        assertThat(exitCode).isZero();
        verify(toolchain).assemble(contains("main:"), eq(exe));
        verify(toolchain, never()).run(any());
    }

    @Test
    void assembleFallsBackToConfiguredOutput() throws Exception {
        commandLine.execute("compile", "--assemble", "3 4 +");

        verify(toolchain).assemble(anyString(), eq(Path.of("a.out")));
    }

    @Test
    void runPrintsProgramOutputAndExitCode() throws Exception {
        Path exe = tempDir.resolve("calc");
        when(toolchain.run(exe)).thenReturn(new ExecutionResult(0, "Result 7\n"));

        int exitCode = commandLine.execute("compile", "--run", "-o", exe.toString(), "3 4 +");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("Result 7\n");
        verify(toolchain).assemble(anyString(), eq(exe));
    }

    @Test
    void toolchainFailureIsReported() throws Exception {
        doThrow(new ToolchainException("Failed to launch gcc: not found"))
                .when(toolchain).assemble(anyString(), any());

        int exitCode = commandLine.execute("compile", "--run", "3 4 +");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error launching toolchain: Failed to launch gcc");
    }
}
