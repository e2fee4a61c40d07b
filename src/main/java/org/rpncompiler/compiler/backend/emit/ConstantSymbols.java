package org.rpncompiler.compiler.backend.emit;

/**
 * Maps constant pool literals to assembler symbols.
 * <p>
 * The mapping depends on the literal text only: {@code 3 -> const_3},
 * {@code 0.03 -> const_0_03}, {@code -3.3 -> const_neg_3_3}. A leading minus becomes
 * the {@code neg_} marker, so {@code -0} and {@code 0} stay distinct.
 */
public final class ConstantSymbols {

    private static final String PREFIX = "const_";
    private static final String NEGATIVE_MARKER = "neg_";

    private ConstantSymbols() {}

    /**
     * @param literal A numeric literal as produced by the lexer.
     * @return The data-section symbol for the literal.
     */
    public static String symbolFor(String literal) {
        StringBuilder sb = new StringBuilder(PREFIX);
        if (literal.startsWith("-")) {
            sb.append(NEGATIVE_MARKER);
        }
        for (char c : literal.toCharArray()) {
            switch (c) {
                case '-' -> { }
                case '.' -> sb.append('_');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
