package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.DataCells;
import org.rpncompiler.compiler.backend.emit.Labels;
import org.rpncompiler.compiler.backend.emit.RuntimeErrorHandler;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;

/**
 * Integer power: the top value is the exponent, the one below it the base, both truncated.
 * <p>
 * An exponent of zero or below yields 0, an exponent of one yields the base. Otherwise the
 * base is multiplied into {@code rax} exponent-1 times, leaving through the overflow handler
 * as soon as a product no longer fits in 64 bits.
 * Registers: {@code rsi} remaining exponent, {@code rcx} base, {@code rax} accumulator.
 */
public final class PowerEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        String positive = Labels.of(IrOpcode.POWER, "positive", index);
        String loop = Labels.of(IrOpcode.POWER, "loop", index);
        String store = Labels.of(IrOpcode.POWER, "store", index);

        popTo(asm, DataCells.OP_A);
        truncate(asm, DataCells.OP_A, "rsi");
        popTo(asm, DataCells.OP_B);
        truncate(asm, DataCells.OP_B, "rax");

        asm.instr("cmp", "rsi", "0");
        asm.instr("jg", positive);
        asm.comment("x ^ 0 is 0 here, as are negative exponents");
        asm.instr("xor", "eax", "eax");
        asm.instr("jmp", store);
        asm.label(positive);
        asm.instr("mov", "rcx", "rax");
        asm.instr("dec", "rsi");
        asm.instr("jz", store);
        asm.label(loop);
        asm.instr("imul", "rax", "rcx");
        asm.instr("jo", RuntimeErrorHandler.REGISTER_OVERFLOW.label());
        asm.instr("dec", "rsi");
        asm.instr("jnz", loop);
        asm.label(store);
        pushInteger(asm, "rax");
    }
}
