package org.rpncompiler.compiler.backend.emit;

import org.rpncompiler.compiler.backend.emit.features.DivideEmitter;
import org.rpncompiler.compiler.backend.emit.features.DupEmitter;
import org.rpncompiler.compiler.backend.emit.features.FactorialEmitter;
import org.rpncompiler.compiler.backend.emit.features.FpuBinaryEmitter;
import org.rpncompiler.compiler.backend.emit.features.FpuUnaryEmitter;
import org.rpncompiler.compiler.backend.emit.features.ModulusEmitter;
import org.rpncompiler.compiler.backend.emit.features.PowerEmitter;
import org.rpncompiler.compiler.backend.emit.features.PushEmitter;
import org.rpncompiler.compiler.backend.emit.features.SwapEmitter;
import org.rpncompiler.compiler.backend.emit.features.TanEmitter;
import org.rpncompiler.compiler.ir.IrOpcode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of instruction emitters, one per opcode.
 */
public final class EmissionRegistry {

	private final Map<IrOpcode, IInstructionEmitter> emitters = new EnumMap<>(IrOpcode.class);

	/**
	 * Registers (or replaces) the emitter for an opcode.
	 * @param opcode The opcode.
	 * @param emitter The emitter to use for it.
	 */
	public void register(IrOpcode opcode, IInstructionEmitter emitter) { emitters.put(opcode, emitter); }

	/**
	 * @param opcode The opcode.
	 * @return The registered emitter.
	 * @throws IllegalStateException if no emitter is registered for the opcode.
	 */
	public IInstructionEmitter emitterFor(IrOpcode opcode) {
		IInstructionEmitter emitter = emitters.get(opcode);
		if (emitter == null) {
			throw new IllegalStateException("No emitter registered for " + opcode);
		}
		return emitter;
	}

	/**
	 * Initializes a new emission registry with the built-in emitter of every opcode.
	 * @return A new registry with default emitters.
	 */
	public static EmissionRegistry initializeWithDefaults() {
		EmissionRegistry reg = new EmissionRegistry();
		for (IrOpcode opcode : IrOpcode.values()) {
			reg.register(opcode, defaultEmitter(opcode));
		}
		return reg;
	}

	private static IInstructionEmitter defaultEmitter(IrOpcode opcode) {
		return switch (opcode) {
			case PUSH -> new PushEmitter();
			case PLUS -> new FpuBinaryEmitter("fadd");
			case MINUS -> new FpuBinaryEmitter("fsub");
			case MULTIPLY -> new FpuBinaryEmitter("fmul");
			case DIVIDE -> new DivideEmitter();
			case MODULUS -> new ModulusEmitter();
			case POWER -> new PowerEmitter();
			case ABS -> new FpuUnaryEmitter("fabs");
			case SIN -> new FpuUnaryEmitter("fsin");
			case COS -> new FpuUnaryEmitter("fcos");
			case TAN -> new TanEmitter();
			case SQRT -> new FpuUnaryEmitter("fsqrt");
			case DUP -> new DupEmitter();
			case SWAP -> new SwapEmitter();
			case FACTORIAL -> new FactorialEmitter();
		};
	}
}
