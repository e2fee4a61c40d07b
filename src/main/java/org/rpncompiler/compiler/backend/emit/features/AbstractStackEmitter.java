package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.backend.emit.IInstructionEmitter;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Shared snippets for moving values between the machine stack, the scratch cells
 * and integer registers.
 */
abstract class AbstractStackEmitter implements IInstructionEmitter {

    /** Pops the top of the stack into a scratch cell. Clobbers {@code rax}. */
    protected static void popTo(AsmBuilder asm, String cell) {
        asm.instr("pop", "rax");
        asm.instr("mov", qword(cell), "rax");
    }

    /** Pushes the contents of a scratch cell. Clobbers {@code rax}. */
    protected static void pushFrom(AsmBuilder asm, String cell) {
        asm.instr("mov", "rax", qword(cell));
        asm.instr("push", "rax");
    }

    /** Truncates the double in {@code cell} towards zero into a 64-bit register. */
    protected static void truncate(AsmBuilder asm, String cell, String register) {
        asm.instr("fld", qword(cell));
        asm.instr("fisttp", qword(DataCells.TRUNC));
        asm.instr("mov", register, qword(DataCells.TRUNC));
    }

    /** Converts a 64-bit integer register to a double and pushes it. Clobbers {@code rax}. */
    protected static void pushInteger(AsmBuilder asm, String register) {
        asm.instr("mov", qword(DataCells.TRUNC), register);
        asm.instr("fild", qword(DataCells.TRUNC));
        asm.instr("fstp", qword(DataCells.OP_A));
        pushFrom(asm, DataCells.OP_A);
    }
}
