package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.backend.emit.Labels;
import org.rpncompiler.compiler.backend.emit.RuntimeErrorHandler;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;

/**
 * Integer factorial of the truncated top value. Zero and negative values yield 0.
 * Registers: {@code rcx} countdown, {@code rax} accumulator.
 */
public final class FactorialEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        String loop = Labels.of(IrOpcode.FACTORIAL, "loop", index);
        String store = Labels.of(IrOpcode.FACTORIAL, "store", index);

        popTo(asm, DataCells.OP_A);
        truncate(asm, DataCells.OP_A, "rcx");

        asm.instr("xor", "eax", "eax");
        asm.instr("cmp", "rcx", "0");
        asm.instr("jle", store);
        asm.instr("mov", "eax", "1");
        asm.label(loop);
        asm.instr("imul", "rax", "rcx");
        asm.instr("jo", RuntimeErrorHandler.REGISTER_OVERFLOW.label());
        asm.instr("dec", "rcx");
        asm.instr("jnz", loop);
        asm.label(store);
        pushInteger(asm, "rax");
    }
}
