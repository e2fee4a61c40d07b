package org.rpncompiler.compiler.backend.emit.features;

import org.rpncompiler.compiler.backend.emit.AsmBuilder;
import org.rpncompiler.compiler.backend.emit.ConstantSymbols;
import org.rpncompiler.compiler.ir.IrInstruction;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * Pushes a constant from the data section.
 */
public final class PushEmitter extends AbstractStackEmitter {

    @Override
    public void emit(IrInstruction instruction, int index, AsmBuilder asm) {
        asm.instr("mov", "rax", qword(ConstantSymbols.symbolFor(instruction.value())));
        asm.instr("push", "rax");
    }
}
