package org.rpncompiler.compiler.api;

import org.rpncompiler.compiler.ir.IrInstruction;

import java.util.List;

/**
 * The immutable result of a successful compilation.
 *
 * @param programName The name the program was compiled under.
 * @param assembly The complete assembly-language program text.
 * @param constants The constant pool literals, in the order they appear in the data section.
 * @param instructions The intermediate instructions the body was generated from.
 */
public record ProgramArtifact(
        String programName,
        String assembly,
        List<String> constants,
        List<IrInstruction> instructions
) {
    public ProgramArtifact {
        constants = List.copyOf(constants);
        instructions = List.copyOf(instructions);
    }
}
