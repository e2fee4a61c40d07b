package org.rpncompiler.compiler.backend.emit;

import org.rpncompiler.compiler.ir.IrInstruction;
import org.rpncompiler.compiler.ir.IrOpcode;
import org.rpncompiler.compiler.ir.IrProgram;

import java.util.List;

import static org.rpncompiler.compiler.backend.emit.AsmBuilder.address;
import static org.rpncompiler.compiler.backend.emit.AsmBuilder.qword;

/**
 * The Emitter is the final stage of the compiler backend. It turns the IR program
 * into a complete x86-64 assembly program (GNU as, Intel syntax without prefixes):
 * the data section with scratch cells, messages and constants, the entry sequence,
 * one code block per instruction and the shared footer with result printing and
 * error exits.
 * <p>
 * Every block is framed by the run-time stack-depth protocol: a guard that jumps to
 * the insufficient-stack handler when fewer values than the opcode needs are present,
 * and an update of the depth cell by the opcode's net stack effect.
 */
public class Emitter {

    private final EmissionRegistry registry;

    public Emitter() {
        this(EmissionRegistry.initializeWithDefaults());
    }

    /**
     * @param registry The emitters to generate instruction bodies with.
     */
    public Emitter(EmissionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Emits the assembly program.
     *
     * @param program The IR program.
     * @param debug   {@code true} to insert a breakpoint after the entry sequence.
     * @return The assembly text.
     */
    public String emit(IrProgram program, boolean debug) {
        AsmBuilder asm = new AsmBuilder();
        emitHeader(asm, program.programName(), program.constants());
        emitEntry(asm, debug);

        List<IrInstruction> instructions = program.instructions();
        for (int i = 0; i < instructions.size(); i++) {
            emitBlock(asm, instructions.get(i), i);
        }

        emitFooter(asm);
        return asm.toString();
    }

    private void emitHeader(AsmBuilder asm, String programName, List<String> constants) {
        asm.line("#")
                .line("# Generated by rpn-compiler from " + singleLine(programName))
                .line("#")
                .line(".intel_syntax noprefix")
                .line(".global main")
                .blank()
                .line(".data");
        asm.data(DataCells.OP_A, ".double", "0.0");
        asm.data(DataCells.OP_B, ".double", "0.0");
        asm.data(DataCells.DEPTH, ".quad", "0");
        asm.data(DataCells.TRUNC, ".quad", "0");
        asm.blank();
        asm.data(DataCells.RESULT_FORMAT, ".asciz", quoted("Result %g"));
        for (RuntimeErrorHandler handler : RuntimeErrorHandler.values()) {
            asm.data(handler.messageSymbol(), ".asciz", quoted(handler.message()));
        }
        asm.blank();
        for (String literal : constants) {
            asm.data(ConstantSymbols.symbolFor(literal), ".double", literal);
        }
        asm.blank();
    }

    private void emitEntry(AsmBuilder asm, boolean debug) {
        asm.line(".text")
                .label("main")
                .instr("push", "rbp")
                .comment("the evaluation stack starts empty")
                .instr("mov", qword(DataCells.DEPTH), "0");
        if (debug) {
            asm.comment("debug break");
            asm.instr("int3");
        }
    }

    private void emitBlock(AsmBuilder asm, IrInstruction instruction, int index) {
        IrOpcode opcode = instruction.opcode();
        asm.blank();
        asm.comment("[" + instruction + "]");
        if (opcode.requiredDepth() > 0) {
            emitDepthGuard(asm, opcode.requiredDepth());
        }
        registry.emitterFor(opcode).emit(instruction, index, asm);
        emitDepthUpdate(asm, opcode.depthDelta());
    }

    private static void emitDepthGuard(AsmBuilder asm, int required) {
        asm.instr("mov", "rax", qword(DataCells.DEPTH));
        asm.instr("cmp", "rax", String.valueOf(required));
        asm.instr("jb", RuntimeErrorHandler.STACK_UNDERFLOW.label());
    }

    private static void emitDepthUpdate(AsmBuilder asm, int delta) {
        if (delta == 1) {
            asm.instr("inc", qword(DataCells.DEPTH));
        } else if (delta == -1) {
            asm.instr("dec", qword(DataCells.DEPTH));
        } else if (delta != 0) {
            asm.instr("add", qword(DataCells.DEPTH), String.valueOf(delta));
        }
    }

    private static void emitFooter(AsmBuilder asm) {
        asm.blank();
        asm.comment("[PRINT] exactly one value must be left");
        asm.instr("mov", "rax", qword(DataCells.DEPTH));
        asm.instr("cmp", "rax", "1");
        asm.instr("jb", RuntimeErrorHandler.STACK_UNDERFLOW.label());
        asm.instr("ja", RuntimeErrorHandler.STACK_TOO_FULL.label());
        asm.instr("pop", "rax");
        asm.instr("movq", "xmm0", "rax");
        asm.instr("lea", "rdi", address(DataCells.RESULT_FORMAT));
        asm.instr("mov", "eax", "1");
        asm.instr("call", "printf@PLT");
        asm.instr("pop", "rbp");
        asm.instr("xor", "eax", "eax");
        asm.instr("ret");

        RuntimeErrorHandler[] handlers = RuntimeErrorHandler.values();
        for (int i = 0; i < handlers.length; i++) {
            asm.blank();
            asm.label(handlers[i].label());
            asm.instr("lea", "rdi", address(handlers[i].messageSymbol()));
            if (i < handlers.length - 1) {
                asm.instr("jmp", RuntimeErrorHandler.PRINT_AND_EXIT);
            }
        }

        asm.blank();
        asm.comment("the machine stack may be unbalanced here; realign it and leave through exit()");
        asm.label(RuntimeErrorHandler.PRINT_AND_EXIT);
        asm.instr("and", "rsp", "-16");
        asm.instr("xor", "eax", "eax");
        asm.instr("call", "printf@PLT");
        asm.instr("xor", "edi", "edi");
        asm.instr("call", "exit@PLT");
        asm.blank();
        asm.line(".section .note.GNU-stack,\"\",@progbits");
    }

    // A line break in a comment would end it and leave the rest as code.
    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    private static String quoted(String message) {
        return "\"" + message + "\\n\"";
    }
}
