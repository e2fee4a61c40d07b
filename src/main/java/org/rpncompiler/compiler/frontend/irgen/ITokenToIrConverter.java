package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.frontend.lexer.Token;

/**
 * Converts a token into IR.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 */
public interface ITokenToIrConverter {

	/**
	 * Converts the given token into IR and emits results via the provided context.
	 *
	 * @param token The token to convert.
	 * @param ctx   The IR generation context used to emit instructions and access diagnostics.
	 */
	void convert(Token token, IrGenContext ctx);
}
