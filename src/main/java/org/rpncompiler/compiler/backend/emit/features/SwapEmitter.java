package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.ir.IrInstruction;

public final class SwapEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        asm.instr("pop", "rax");
        asm.instr("pop", "rcx");
        asm.instr("push", "rax");
        asm.instr("push", "rcx");
    }
}
