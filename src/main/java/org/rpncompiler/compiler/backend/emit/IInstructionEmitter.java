package org.rpncompiler.compiler.backend.emit;

import org.rpncompiler.compiler.ir.IrInstruction;

/**
 * Generates the body of the code block for one instruction.
 * <p>
 * The {@link Emitter} wraps every body with the stack-depth guard and the depth update
 * derived from the opcode, so implementations only pop, compute and push. Implementations
 * may use {@code rax}, {@code rcx}, {@code rdx}, {@code rsi} and the scratch cells freely;
 * nothing is live across blocks except the machine stack and the depth cell.
 */
public interface IInstructionEmitter {

	/**
	 * @param instruction The instruction.
	 * @param index       Its position in the program, for unique labels.
	 * @param asm         The builder receiving the code.
	 */
	void emit(IrInstruction instruction, int index, AsmBuilder asm);
}
