package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.backend.emit.Labels;
import org.rpncompiler.compiler.backend.emit.RuntimeErrorHandler;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;

/**
 * Integer remainder of the second value divided by the top value, both truncated.
 * <p>
 * Registers: {@code rcx} divisor, {@code rax} dividend, {@code rdx} remainder.
 * A zero divisor jumps to the division-by-zero handler; a divisor of -1 yields 0
 * without executing {@code idiv}, which would trap for the smallest 64-bit value.
 */
public final class ModulusEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        String store = Labels.of(IrOpcode.MODULUS, "store", index);

        popTo(asm, DataCells.OP_A);
        truncate(asm, DataCells.OP_A, "rcx");
        popTo(asm, DataCells.OP_B);
        truncate(asm, DataCells.OP_B, "rax");

        asm.instr("test", "rcx", "rcx");
        asm.instr("jz", RuntimeErrorHandler.DIVISION_BY_ZERO.label());
        asm.instr("xor", "rdx", "rdx");
        asm.instr("cmp", "rcx", "-1");
        asm.instr("je", store);
        asm.instr("cqo");
        asm.instr("idiv", "rcx");
        asm.label(store);
        pushInteger(asm, "rdx");
    }
}
