package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.api.SourceInfo;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.ir.ConstantPool;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed to converters during IR generation.
 * Owns the instruction list and constant pool of a single compilation.
 */
public final class IrGenContext {

	private final String programName;
	private final DiagnosticsEngine diagnostics;
	private final List<IrInstruction> out = new ArrayList<>();
	private final ConstantPool constants = new ConstantPool();

	/**
	 * Constructs a new IR generation context.
	 * @param programName The name of the program being compiled.
	 * @param diagnostics The diagnostics engine for reporting errors and warnings.
	 */
	public IrGenContext(String programName, DiagnosticsEngine diagnostics) {
		this.programName = programName;
		this.diagnostics = diagnostics;
	}

	/**
	 * Emits a new IR instruction.
	 * @param instruction The instruction to append.
	 */
	public void emit(IrInstruction instruction) {
		out.add(instruction);
	}

	/**
	 * Records a literal in the constant pool.
	 * @param literal The literal text.
	 */
	public void addConstant(String literal) {
		constants.add(literal);
	}

	/**
	 * @return The diagnostics engine.
	 */
	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public String programName() {
		return programName;
	}

	public SourceInfo sourceOf(Token token) {
		return new SourceInfo(programName, token.column(), token.text());
	}

	/**
	 * @return The program built so far.
	 */
	public IrProgram build() {
		return new IrProgram(programName, out, constants.literals());
	}
}
