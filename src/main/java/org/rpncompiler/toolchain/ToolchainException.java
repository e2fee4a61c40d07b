package org.rpncompiler.toolchain;

/**
 * Thrown when the external assembler cannot be started, fails, or a produced program
 * cannot be executed.
 */
public class ToolchainException extends Exception {

    /**
     * @param message The detail message.
     */
    public ToolchainException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
