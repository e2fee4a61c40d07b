package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.ir.IrInstruction;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Tangent as sine over cosine.
 */
public final class TanEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        popTo(asm, DataCells.OP_A);
        asm.instr("fld", qword(DataCells.OP_A));
        asm.comment("st(0) = cos, st(1) = sin");
        asm.instr("fsincos");
        asm.instr("fstp", qword(DataCells.OP_B));
        asm.instr("fdiv", qword(DataCells.OP_B));
        asm.instr("fstp", qword(DataCells.OP_A));
        pushFrom(asm, DataCells.OP_A);
    }
}
