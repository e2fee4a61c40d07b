package org.rpncompiler.compiler.frontend.irgen.converters;

import org.rpncompiler.compiler.frontend.irgen.ITokenToIrConverter;
import org.rpncompiler.compiler.frontend.irgen.IrGenContext;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;

/**
 * Converts an operator or keyword into its value-less instruction.
 */
public final class OperatorTokenConverter implements ITokenToIrConverter {

	private final IrOpcode opcode;

	/**
	 * @param opcode The opcode emitted for every token this converter handles.
	 */
	public OperatorTokenConverter(IrOpcode opcode) {
		this.opcode = opcode;
	}

	@Override
	public void convert(Token token, IrGenContext ctx) {
		ctx.emit(IrInstruction.of(opcode, ctx.sourceOf(token)));
	}
}
