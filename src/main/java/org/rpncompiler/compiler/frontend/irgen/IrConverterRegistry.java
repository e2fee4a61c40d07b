package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.frontend.irgen.converters.NumberTokenConverter;
import org.rpncompiler.compiler.frontend.irgen.converters.OperatorTokenConverter;
import org.rpncompiler.compiler.frontend.lexer.TokenType;
import org.rpncompiler.compiler.ir.IrOpcode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry mapping token types to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback for token types
 * without a registered converter.
 */
public final class IrConverterRegistry {

	private final Map<TokenType, ITokenToIrConverter> byType = new EnumMap<>(TokenType.class);
	private final ITokenToIrConverter defaultConverter;

	private IrConverterRegistry(ITokenToIrConverter defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given token type.
	 *
	 * @param type      The token type.
	 * @param converter The converter instance handling that type.
	 */
	public void register(TokenType type, ITokenToIrConverter converter) {
		byType.put(type, converter);
	}

	/**
	 * Resolves a converter for the given type, falling back to the default converter.
	 *
	 * @param type The token type.
	 * @return A non-null converter.
	 */
	public ITokenToIrConverter resolve(TokenType type) {
		return byType.getOrDefault(type, defaultConverter);
	}

	/**
	 * Creates an empty registry with the given default converter.
	 *
	 * @param defaultConverter The fallback converter used for unregistered token types.
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize(ITokenToIrConverter defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and registers all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultTokenToIrConverter());
		reg.register(TokenType.NUMBER, new NumberTokenConverter());
		reg.register(TokenType.PLUS, new OperatorTokenConverter(IrOpcode.PLUS));
		reg.register(TokenType.MINUS, new OperatorTokenConverter(IrOpcode.MINUS));
		reg.register(TokenType.ASTERISK, new OperatorTokenConverter(IrOpcode.MULTIPLY));
		reg.register(TokenType.SLASH, new OperatorTokenConverter(IrOpcode.DIVIDE));
		reg.register(TokenType.MOD, new OperatorTokenConverter(IrOpcode.MODULUS));
		reg.register(TokenType.POWER, new OperatorTokenConverter(IrOpcode.POWER));
		reg.register(TokenType.FACTORIAL, new OperatorTokenConverter(IrOpcode.FACTORIAL));
		reg.register(TokenType.ABS, new OperatorTokenConverter(IrOpcode.ABS));
		reg.register(TokenType.SIN, new OperatorTokenConverter(IrOpcode.SIN));
		reg.register(TokenType.COS, new OperatorTokenConverter(IrOpcode.COS));
		reg.register(TokenType.TAN, new OperatorTokenConverter(IrOpcode.TAN));
		reg.register(TokenType.SQRT, new OperatorTokenConverter(IrOpcode.SQRT));
		reg.register(TokenType.DUP, new OperatorTokenConverter(IrOpcode.DUP));
		reg.register(TokenType.SWAP, new OperatorTokenConverter(IrOpcode.SWAP));
		return reg;
	}
}
