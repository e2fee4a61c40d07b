package org.rpncompiler.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** The lexer found an identifier that is not a keyword. */
    UNKNOWN_TOKEN,
    // endregion

    // region Program Shape Errors
    /** The expression contained no tokens at all. */
    EMPTY_PROGRAM,
    /** The first token of the expression is not a number. */
    PROGRAM_MUST_START_WITH_NUMBER,
    /** A program of more than one token ends with a number that nothing consumes. */
    PROGRAM_ENDS_WITH_NUMBER,
    // endregion

    // region IR Generation Errors
    /** A token reached IR generation for which no instruction exists. */
    UNSUPPORTED_TOKEN,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
