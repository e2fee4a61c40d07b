package org.rpncompiler.compiler.frontend.irgen;

import org.rpncompiler.compiler.api.CompilerErrorCode;
import org.rpncompiler.compiler.diagnostics.DiagnosticsEngine;
import org.rpncompiler.compiler.frontend.irgen.converters.NumberTokenConverter;
import org.rpncompiler.compiler.frontend.lexer.Lexer;
import org.rpncompiler.compiler.frontend.lexer.Token;
import org.rpncompiler.compiler.frontend.lexer.TokenType;
import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;
import org.rpncompiler.compiler.ir.IrProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

public class IrGeneratorTest {

    private IrProgram compileToIr(String expression) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new TokenCollector(diagnostics, "TestProg").collect(new Lexer(expression));
        if (diagnostics.hasErrors()) {
            fail("Lexer errors: " + diagnostics.summary());
        }
        IrProgram ir = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults()).generate(tokens, "TestProg");
        if (diagnostics.hasErrors()) {
            fail("IR generation errors: " + diagnostics.summary());
        }
        return ir;
    }

    @Test
    @Tag("unit")
    void generatesInstructionsInTokenOrder() {
        IrProgram ir = compileToIr("3 4 + 2 * 5 / 6 - 7 % 2 ^ ! abs sin cos tan sqrt dup swap");

        assertThat(ir.instructions()).extracting(IrInstruction::opcode).containsExactly(
                IrOpcode.PUSH, IrOpcode.PUSH, IrOpcode.PLUS,
                IrOpcode.PUSH, IrOpcode.MULTIPLY,
                IrOpcode.PUSH, IrOpcode.DIVIDE,
                IrOpcode.PUSH, IrOpcode.MINUS,
                IrOpcode.PUSH, IrOpcode.MODULUS,
                IrOpcode.PUSH, IrOpcode.POWER,
                IrOpcode.FACTORIAL, IrOpcode.ABS, IrOpcode.SIN, IrOpcode.COS, IrOpcode.TAN,
                IrOpcode.SQRT, IrOpcode.DUP, IrOpcode.SWAP);
        assertThat(ir.programName()).isEqualTo("TestProg");
    }

    @Test
    @Tag("unit")
    void onlyPushesCarryValues() {
        IrProgram ir = compileToIr("-2.5 3 +");

        assertThat(ir.instructions()).extracting(IrInstruction::value).containsExactly("-2.5", "3", null);
        assertThat(ir.instructions().get(0).source().columnNumber()).isEqualTo(1);
        assertThat(ir.instructions().get(2).source().text()).isEqualTo("+");
    }

    /**
     * The pool is keyed by literal text, so "3" and "3.0" are separate entries
     * while a repeated "3" is recorded once, in first-use order.
     */
    @Test
    @Tag("unit")
    void constantPoolDeduplicatesByLiteralText() {
        IrProgram ir = compileToIr("3 3.0 + 3 * 1 +");

        assertThat(ir.constants()).containsExactly("3", "3.0", "1");
    }

    @Test
    @Tag("unit")
    void namedConstantsBecomeNumbers() {
        IrProgram ir = compileToIr("pi e +");

        assertThat(ir.instructions().get(0)).isEqualTo(
                new IrInstruction(IrOpcode.PUSH, "3.141593", ir.instructions().get(0).source()));
        assertThat(ir.instructions().get(1).value()).isEqualTo("2.718282");
        assertThat(ir.constants()).containsExactly(TokenCollector.PI_LITERAL, TokenCollector.E_LITERAL);
    }

    @Test
    @Tag("unit")
    void collectorStopsAtFirstErrorToken() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new TokenCollector(diagnostics, "TestProg").collect(new Lexer("3 5 $ +"));

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.firstErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_TOKEN);
        assertThat(diagnostics.summary()).contains("Unknown token $");
        assertThat(tokens).extracting(Token::text).containsExactly("3", "5");
    }

    @Test
    @Tag("unit")
    void unregisteredTokenTypeIsReportedByDefaultConverter() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        IrGenerator generator = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults());

        IrProgram ir = generator.generate(List.of(new Token(TokenType.PI, "pi", 1)), "TestProg");

        assertThat(ir.instructions()).isEmpty();
        assertThat(diagnostics.firstErrorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_TOKEN);
    }

    @Test
    @Tag("unit")
    void registryFallsBackToDefaultConverter() {
        IrConverterRegistry registry = IrConverterRegistry.initializeWithDefaults();

        assertThat(registry.resolve(TokenType.NUMBER)).isInstanceOf(NumberTokenConverter.class);
        assertThat(registry.resolve(TokenType.END_OF_FILE)).isInstanceOf(DefaultTokenToIrConverter.class);
        assertThat(registry.resolve(TokenType.ERROR)).isInstanceOf(DefaultTokenToIrConverter.class);
    }
}
