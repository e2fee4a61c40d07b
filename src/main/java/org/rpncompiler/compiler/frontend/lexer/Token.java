package org.rpncompiler.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the expression by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Number, Plus, Sqrt).
 * @param text The literal text of the token. For numbers this is the exact matched
 *             substring including the sign; for errors it describes what was found.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int column
) {
}
