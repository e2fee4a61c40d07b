package org.rpncompiler.compiler.backend.emit;

import org.rpncompiler.compiler.ir.IrOpcode;

import java.util.Locale;

/**
 * Renders block-local labels. The instruction index makes a label unique even when
 * the same operation occurs several times in one program.
 */
public final class Labels {

    private Labels() {}

    /**
     * @param opcode The operation that owns the label.
     * @param role   The purpose of the label inside the block, e.g. {@code loop}.
     * @param index  The position of the instruction in the program.
     * @return A label such as {@code power_loop_4}.
     */
    public static String of(IrOpcode opcode, String role, int index) {
        return opcode.name().toLowerCase(Locale.ROOT) + "_" + role + "_" + index;
    }
}
