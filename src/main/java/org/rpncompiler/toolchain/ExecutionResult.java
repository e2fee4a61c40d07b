package org.rpncompiler.toolchain;

/**
 * Outcome of running a program.
 *
 * @param exitCode The process exit code.
 * @param output Everything the program wrote to standard output.
 */
public record ExecutionResult(int exitCode, String output) {
}
