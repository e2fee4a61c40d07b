package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.lexer.Lexer;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drains a {@link Lexer} into an owned token list.
 * <p>
 * The named constants {@code e} and {@code pi} are rewritten into number tokens as they
 * arrive, so later phases never see them. The first error token aborts collection.
 */
public final class TokenCollector {

    /** Literal text used for {@code e}. */
    public static final String E_LITERAL = String.format(Locale.ROOT, "%f", Math.E);
    /** Literal text used for {@code pi}. */
    public static final String PI_LITERAL = String.format(Locale.ROOT, "%f", Math.PI);

    private final DiagnosticsEngine diagnostics;
    private final String programName;

    /**
     * @param diagnostics The engine lexical errors are reported to.
     * @param programName The program name for diagnostics.
     */
    public TokenCollector(DiagnosticsEngine diagnostics, String programName) {
        this.diagnostics = diagnostics;
        this.programName = programName;
    }

    /**
     * Collects all tokens before end-of-file.
     * @param lexer The lexer positioned at the start of the expression.
     * @return The tokens, without the end-of-file marker. Partial if an error was reported.
     */
    public List<Token> collect(Lexer lexer) {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token tok = lexer.nextToken();
            if (tok.type() == TokenType.END_OF_FILE) {
                break;
            }
            if (tok.type() == TokenType.ERROR) {
                diagnostics.reportError(CompilerErrorCode.UNKNOWN_TOKEN,
                        "Error parsing input; " + tok.text(), programName, tok.column());
                break;
            }
            tokens.add(rewriteNamedConstant(tok));
        }
        return tokens;
    }

    private static Token rewriteNamedConstant(Token tok) {
        return switch (tok.type()) {
            case E -> new Token(TokenType.NUMBER, E_LITERAL, tok.column());
            case PI -> new Token(TokenType.NUMBER, PI_LITERAL, tok.column());
            default -> tok;
        };
    }
}
