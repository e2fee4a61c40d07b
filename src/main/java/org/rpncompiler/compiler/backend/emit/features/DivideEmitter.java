package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.backend.emit.RuntimeErrorHandler;
import org.rpncompiler.compiler.ir.IrInstruction;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Floating-point division of the second value by the top value.
 * A divisor of +0.0 or -0.0 jumps to the division-by-zero handler.
 */
public final class DivideEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        asm.instr("pop", "rax");
        asm.comment("shifting out the sign bit leaves zero only for +0.0 and -0.0");
        asm.instr("mov", "rcx", "rax");
        asm.instr("shl", "rcx", "1");
        asm.instr("jz", RuntimeErrorHandler.DIVISION_BY_ZERO.label());
        asm.instr("mov", qword(DataCells.OP_A), "rax");
        popTo(asm, DataCells.OP_B);
        asm.instr("fld", qword(DataCells.OP_B));
        asm.instr("fdiv", qword(DataCells.OP_A));
        asm.instr("fstp", qword(DataCells.OP_A));
        pushFrom(asm, DataCells.OP_A);
    }
}
