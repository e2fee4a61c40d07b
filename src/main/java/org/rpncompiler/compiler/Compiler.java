package org.rpncompiler.compiler;

import org.rpncompiler.compiler.api.CompilationException;
import org.rpncompiler.compiler.api.ICompiler;
import org.rpncompiler.compiler.api.ProgramArtifact;
import org.rpncompiler.compiler.backend.emit.Emitter;
import org.rpncompiler.compiler.diagnostics.CompilerLogger;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.irgen.IrConverterRegistry;
import org.rpncompiler.compiler.frontend.irgen.IrGenerator;
import org.rpncompiler.compiler.frontend.irgen.TokenCollector;
import org.rpncompiler.compiler.frontend.lexer.Lexer;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.frontend.semantics.ProgramShapeAnalyzer;
import org.rpncompiler.compiler.ir.IrProgram;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from an RPN
 * expression to an assembly program: lexing, shape validation, IR generation and emission.
 * <p>
 * Every call to {@link #compile(String, String)} works on its own diagnostics, tokens,
 * instructions and constant pool, and the debug flag is per instance. Verbosity is not:
 * {@link CompilerLogger} is process-wide, so a verbosity set on one instance applies to
 * the log output of all of them.
 */
public class Compiler implements ICompiler {

    private boolean debug = false;
    private int verbosity = -1;

    /**
     * {@inheritDoc}
     */
    @Override
    public ProgramArtifact compile(String expression, String programName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setVerbosity(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new TokenCollector(diagnostics, programName).collect(new Lexer(expression));
        failOnErrors(diagnostics);
        CompilerLogger.phase(programName, "lex", "{} tokens", tokens.size());

        // Phase 2: Program shape validation
        new ProgramShapeAnalyzer(diagnostics, programName).analyze(tokens);
        failOnErrors(diagnostics);

        // Phase 3: IR Generation
        IrGenerator irGenerator = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults());
        IrProgram irProgram = irGenerator.generate(tokens, programName);
        failOnErrors(diagnostics);
        CompilerLogger.phase(programName, "irgen", "{} instructions, {} constants",
                irProgram.instructions().size(), irProgram.constants().size());
        CompilerLogger.trace("IR of {}: {}", programName, irProgram.instructions());

        // Phase 4: Emission
        String assembly;
        try {
            assembly = new Emitter().emit(irProgram, debug);
        } catch (RuntimeException re) {
            throw new CompilationException(re.getMessage(), re);
        }

        CompilerLogger.phase(programName, "emit", "{} characters of assembly", assembly.length());
        return new ProgramArtifact(programName, assembly, irProgram.constants(), irProgram.instructions());
    }

    private static void failOnErrors(DiagnosticsEngine diagnostics) throws CompilationException {
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.firstErrorCode());
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Applied to the process-wide {@link CompilerLogger} on the next {@link #compile(String, String)}.
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
