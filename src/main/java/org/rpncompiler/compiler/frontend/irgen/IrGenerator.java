package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.ir.IrProgram;

import java.util.List;

/**
 * Phase: Generates IR from a validated token list by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a diagnostics engine and a prepared registry.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 * @param registry    The converter registry.
	 */
	public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
		this.diagnostics = diagnostics;
		this.registry = registry;
	}

	/**
	 * Generates a linear IR program, one converter call per token, in token order.
	 *
	 * @param tokens      The validated tokens, without the end-of-file marker.
	 * @param programName The program name used for IR metadata and diagnostics.
	 * @return The generated IR program.
	 */
	public IrProgram generate(List<Token> tokens, String programName) {
		IrGenContext ctx = new IrGenContext(programName, diagnostics);
		for (Token token : tokens) {
			registry.resolve(token.type()).convert(token, ctx);
		}
		return ctx.build();
	}
}
