package org.rpncompiler.compiler.frontend.irgen.converters;

import org.rpncompiler.compiler.frontend.irgen.ITokenToIrConverter;
import org.rpncompiler.compiler.frontend.irgen.IrGenContext;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.ir.IrInstruction;

/**
 * Converts a number into a push, recording its literal in the constant pool.
 */
public final class NumberTokenConverter implements ITokenToIrConverter {

	@Override
	public void convert(Token token, IrGenContext ctx) {
		ctx.addConstant(token.text());
		ctx.emit(IrInstruction.push(token.text(), ctx.sourceOf(token)));
	}
}
