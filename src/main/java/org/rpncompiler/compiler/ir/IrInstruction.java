package org.rpncompiler.compiler.ir;

import org.rpncompiler.compiler.api.SourceInfo;

/**
 * Represents an instruction in the intermediate representation.
 * <p>
 * Only {@link IrOpcode#PUSH} carries a value: the literal text of the constant to push.
 *
 * @param opcode The operation.
 * @param value  The literal for a push, {@code null} otherwise.
 * @param source The token the instruction was generated from.
 */
public record IrInstruction(IrOpcode opcode, String value, SourceInfo source) {

    public IrInstruction {
        if (opcode == null) {
            throw new IllegalArgumentException("opcode must not be null");
        }
        if (opcode == IrOpcode.PUSH && (value == null || value.isEmpty())) {
            throw new IllegalArgumentException("PUSH requires a literal value");
        }
        if (opcode != IrOpcode.PUSH && value != null) {
            throw new IllegalArgumentException(opcode + " does not take a value");
        }
    }

    /**
     * Creates a push of the given literal.
     * @param literal The numeric literal text.
     * @param source The originating token.
     * @return The push instruction.
     */
    public static IrInstruction push(String literal, SourceInfo source) {
        return new IrInstruction(IrOpcode.PUSH, literal, source);
    }

    /**
     * Creates a value-less instruction.
     * @param opcode Any opcode except {@link IrOpcode#PUSH}.
     * @param source The originating token.
     * @return The instruction.
     */
    public static IrInstruction of(IrOpcode opcode, SourceInfo source) {
        return new IrInstruction(opcode, null, source);
    }

    @Override
    public String toString() {
        return value == null ? opcode.name() : opcode.name() + " " + value;
    }
}
