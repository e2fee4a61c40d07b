package org.rpncompiler.toolchain;

import java.nio.file.Path;

/**
 * Turns generated assembly into an executable and runs it.
 */
public interface IToolchain {

    /**
     * Assembles and links a program.
     *
     * @param assembly The assembly text.
     * @param output The executable to create.
     * @throws ToolchainException if the assembler cannot be run or reports a failure.
     */
    void assemble(String assembly, Path output) throws ToolchainException;

    /**
     * Runs an executable and collects its standard output.
     *
     * @param executable The program to run.
     * @return Exit code and output.
     * @throws ToolchainException if the program cannot be started or does not finish in time.
     */
    ExecutionResult run(Path executable) throws ToolchainException;
}
