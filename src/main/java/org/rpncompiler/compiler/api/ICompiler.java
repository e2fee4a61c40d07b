package org.rpncompiler.compiler.api;

/**
 * Defines the public, clean interface for the RPN compiler.
 */
public interface ICompiler {

    /** The program name used when the caller does not supply one. */
    String DEFAULT_PROGRAM_NAME = "<expression>";

    /**
     * Compiles an RPN expression into an assembly-language program.
     *
     * @param expression The RPN expression, tokens separated by whitespace.
     * @param programName A name for the program, used for diagnostics and artifact metadata.
     * @return A {@link ProgramArtifact} containing the assembly text and associated metadata.
     * @throws CompilationException if the expression is lexically or structurally invalid.
     */
    ProgramArtifact compile(String expression, String programName) throws CompilationException;

    /**
     * Enables or disables the debug breakpoint at the start of the generated program.
     * @param debug {@code true} to insert the breakpoint.
     */
    void setDebug(boolean debug);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles an expression under the default program name.
     * @param expression The RPN expression.
     * @return The compiled program artifact.
     * @throws CompilationException if the expression is lexically or structurally invalid.
     */
    default ProgramArtifact compile(String expression) throws CompilationException {
        return compile(expression, DEFAULT_PROGRAM_NAME);
    }
}
