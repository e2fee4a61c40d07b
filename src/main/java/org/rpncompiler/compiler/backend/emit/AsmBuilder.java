package org.rpncompiler.compiler.backend.emit;

/**
 * Line-oriented builder for Intel-syntax (noprefix) assembly text.
 * <p>
 * Instructions are indented by eight spaces, labels start in column one. Data is
 * always addressed RIP-relative so the output links both as PIE and statically.
 */
public final class AsmBuilder {

    private static final String INDENT = "        ";

    private final StringBuilder sb = new StringBuilder();

    /**
     * Appends an instruction.
     * @param mnemonic The mnemonic, e.g. {@code mov}.
     * @param operands The operands in Intel order (destination first).
     * @return this builder.
     */
    public AsmBuilder instr(String mnemonic, String... operands) {
        sb.append(INDENT).append(mnemonic);
        if (operands.length > 0) {
            sb.append(' ').append(String.join(", ", operands));
        }
        sb.append('\n');
        return this;
    }

    /**
     * Appends a label definition.
     * @param name The label name.
     * @return this builder.
     */
    public AsmBuilder label(String name) {
        sb.append(name).append(":\n");
        return this;
    }

    /**
     * Appends an indented comment.
     * @param text The comment text.
     * @return this builder.
     */
    public AsmBuilder comment(String text) {
        sb.append(INDENT).append("# ").append(text).append('\n');
        return this;
    }

    /**
     * Appends a line verbatim, e.g. a directive or a block comment.
     * @param line The line without trailing newline.
     * @return this builder.
     */
    public AsmBuilder line(String line) {
        sb.append(line).append('\n');
        return this;
    }

    /**
     * Appends a data declaration with a right-aligned symbol.
     * @param symbol The symbol name.
     * @param directive The data directive, e.g. {@code .double}.
     * @param value The initial value.
     * @return this builder.
     */
    public AsmBuilder data(String symbol, String directive, String value) {
        sb.append(String.format("%16s: %s %s\n", symbol, directive, value));
        return this;
    }

    public AsmBuilder blank() {
        sb.append('\n');
        return this;
    }

    /**
     * @param symbol A data symbol.
     * @return A quadword memory operand for the symbol.
     */
    public static String qword(String symbol) {
        return "qword ptr " + address(symbol);
    }

    /**
     * @param symbol A data symbol.
     * @return The RIP-relative address of the symbol, for {@code lea}.
     */
    public static String address(String symbol) {
        return "[rip + " + symbol + "]";
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
