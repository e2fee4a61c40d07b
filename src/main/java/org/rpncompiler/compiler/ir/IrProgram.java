package org.rpncompiler.compiler.ir;

import java.util.List;

/**
 * Linear IR program container. The position of an instruction in {@code instructions}
 * is its index for label generation and must be preserved by the backend.
 *
 * @param programName The program name.
 * @param instructions The instructions in token order.
 * @param constants The literals the program pushes, in first-use order.
 */
public record IrProgram(String programName, List<IrInstruction> instructions, List<String> constants) {

    public IrProgram {
        instructions = List.copyOf(instructions);
        constants = List.copyOf(constants);
    }
}
