package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.rpncompiler.compiler.frontend.lexer.Token;

/**
 * Fallback converter for tokens that have no instruction. Reports an error and emits nothing.
 */
public final class DefaultTokenToIrConverter implements ITokenToIrConverter {

	@Override
	public void convert(Token token, IrGenContext ctx) {
		ctx.diagnostics().reportError(CompilerErrorCode.UNSUPPORTED_TOKEN,
				"No instruction for token " + token.type() + " '" + token.text() + "'",
				ctx.programName(), token.column());
	}
}
