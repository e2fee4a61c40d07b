package org.rpncompiler.compiler.api;

/**
 * A pure data class representing a position in the expression.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param programName The name of the program the expression belongs to.
 * @param columnNumber The 1-based column of the token.
 * @param text The token text at that position.
 */
public record SourceInfo(String programName, int columnNumber, String text) {

    @Override
    public String toString() {
        return String.format("%s:%d '%s'", programName, columnNumber, text);
    }
}
