package org.rpncompiler.compiler.api;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     * @param errorCode The code identifying the kind of failure.
     */
    public CompilationException(String message, CompilerErrorCode errorCode) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = CompilerErrorCode.UNKNOWN_ERROR;
    }

    /**
     * @return The code identifying the kind of failure.
     */
    public CompilerErrorCode errorCode() {
        return errorCode;
    }
}
