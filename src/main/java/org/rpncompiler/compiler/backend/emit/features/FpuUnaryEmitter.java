package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.ir.IrInstruction;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Replaces the top value by the result of a single x87 instruction on {@code st(0)}.
 */
public final class FpuUnaryEmitter extends AbstractStackEmitter {

    private final String mnemonic;

    /**
     * @param mnemonic {@code fabs}, {@code fsin}, {@code fcos} or {@code fsqrt}.
     */
    public FpuUnaryEmitter(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        popTo(asm, DataCells.OP_A);
        asm.instr("fld", qword(DataCells.OP_A));
        asm.instr(mnemonic);
        asm.instr("fstp", qword(DataCells.OP_A));
        pushFrom(asm, DataCells.OP_A);
    }
}
