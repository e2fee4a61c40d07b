package org.rpncompiler.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts an RPN expression into a sequence of tokens.
 * <p>
 * Tokens are produced one at a time by {@link #nextToken()}. Once the input is exhausted
 * every further call returns an {@link TokenType#END_OF_FILE} token. Unknown identifiers
 * are not reported here; they come back as {@link TokenType#ERROR} tokens and the caller
 * decides how to fail.
 */
public class Lexer {

    private final String source;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The expression text.
     */
    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Scans the next token, skipping any leading whitespace.
     * @return The next token, or an end-of-file token when the input is exhausted.
     */
    public Token nextToken() {
        skipWhitespace();
        start = current;
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, "", current + 1);
        }

        char c = advance();
        switch (c) {
            case '+': return token(TokenType.PLUS);
            case '*': return token(TokenType.ASTERISK);
            case '/': return token(TokenType.SLASH);
            case '%': return token(TokenType.MOD);
            case '^': return token(TokenType.POWER);
            case '!': return token(TokenType.FACTORIAL);
            case '-':
                // "-3" is a negative literal, "3 - 4" has a MINUS operator.
                if (isDigit(peek())) {
                    advance();
                    return number();
                }
                return token(TokenType.MINUS);
            default:
                if (isDigit(c)) {
                    return number();
                }
                return identifier();
        }
    }

    /**
     * Scans the whole expression.
     * @return All tokens up to and including the terminating end-of-file token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        return token(TokenType.NUMBER);
    }

    private Token identifier() {
        while (!isAtEnd() && !isWhitespace(peek()) && !isDigit(peek())) advance();
        String text = source.substring(start, current);
        return Keywords.lookup(text)
                .map(type -> new Token(type, text, start + 1))
                .orElseGet(() -> new Token(TokenType.ERROR, "Unknown token " + text, start + 1));
    }

    private Token token(TokenType type) {
        return new Token(type, source.substring(start, current), start + 1);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) advance();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
