package org.rpncompiler.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A decimal literal, optionally signed and optionally fractional. */
    NUMBER,

    // Single-character operators.
    /** The '+' character. */
    PLUS,
    /** The '-' character when it is not the sign of a number. */
    MINUS,
    /** The '*' character. */
    ASTERISK,
    /** The '/' character. */
    SLASH,
    /** The '%' character. */
    MOD,
    /** The '^' character. */
    POWER,
    /** The '!' character. */
    FACTORIAL,

    // Keywords.
    /** The {@code abs} keyword. */
    ABS,
    /** The {@code cos} keyword. */
    COS,
    /** The {@code dup} keyword. */
    DUP,
    /** The {@code e} keyword, Euler's number. */
    E,
    /** The {@code pi} keyword. */
    PI,
    /** The {@code sin} keyword. */
    SIN,
    /** The {@code sqrt} keyword. */
    SQRT,
    /** The {@code swap} keyword. */
    SWAP,
    /** The {@code tan} keyword. */
    TAN,

    // Miscellaneous.
    /** Represents the end of the expression. */
    END_OF_FILE,
    /** Represents an identifier that is not a keyword. */
    ERROR
}
