package org.rpncompiler.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of reserved identifiers. Lookups are case-sensitive; only the
 * lowercase spellings are keywords.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "abs", TokenType.ABS,
            "cos", TokenType.COS,
            "dup", TokenType.DUP,
            "e", TokenType.E,
            "pi", TokenType.PI,
            "sin", TokenType.SIN,
            "sqrt", TokenType.SQRT,
            "swap", TokenType.SWAP,
            "tan", TokenType.TAN
    );

    private Keywords() {}

    /**
     * Classifies an identifier.
     * @param identifier The identifier text as read by the lexer.
     * @return The reserved token type, or empty if the identifier is not a keyword.
     */
    public static Optional<TokenType> lookup(String identifier) {
        return Optional.ofNullable(KEYWORDS.get(identifier));
    }
}
