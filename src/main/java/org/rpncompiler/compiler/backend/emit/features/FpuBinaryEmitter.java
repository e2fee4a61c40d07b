package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.ir.IrInstruction;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Floating-point addition, subtraction and multiplication.
 * Computes {@code second OP top}, e.g. {@code 5 3 -} gives 2.
 */
public final class FpuBinaryEmitter extends AbstractStackEmitter {

    private final String mnemonic;

    /**
     * @param mnemonic The x87 instruction taking a memory operand: {@code fadd}, {@code fsub} or {@code fmul}.
     */
    public FpuBinaryEmitter(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        popTo(asm, DataCells.OP_A);
        popTo(asm, DataCells.OP_B);
        asm.instr("fld", qword(DataCells.OP_B));
        asm.instr(mnemonic, qword(DataCells.OP_A));
        asm.instr("fstp", qword(DataCells.OP_A));
        pushFrom(asm, DataCells.OP_A);
    }
}
