package org.rpncompiler.cli.commands;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import org.rpncompiler.cli.CommandLineInterface;
import org.rpncompiler.cli.config.LoggingConfigurator;
import org.rpncompiler.compiler.Compiler;
import org.rpncompiler.compiler.api.CompilationException;
import org.rpncompiler.compiler.api.ProgramArtifact;
import org.rpncompiler.compiler.diagnostics.CompilerLogger;
import org.rpncompiler.toolchain.ExecutionResult;
import org.rpncompiler.toolchain.IToolchain;
import org.rpncompiler.toolchain.ToolchainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "compile",
    description = "Compile an RPN expression, optionally assembling and running it"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", description = "The expression, e.g. '3 4 +'")
    private String expression;

    @Option(names = {"-d", "--debug"}, description = "Insert a debug breakpoint in the generated program")
    private boolean debug;

    @Option(names = {"-v", "--verbose"}, description = "Log compiler phases; repeat for IR traces")
    private boolean[] verbose = new boolean[0];

    @Option(names = {"-a", "--assemble"}, description = "Assemble and link the program with the configured toolchain")
    private boolean assemble;

    @Option(names = {"-r", "--run"}, description = "Run the executable after assembling (implies --assemble)")
    private boolean run;

    @Option(names = {"-o", "--output"}, description = "Executable to write (default: toolchain.output)")
    private Path output;

    @Option(names = {"-e", "--emit"}, description = "Write the assembly to this file instead of standard output")
    private Path emitFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Compiler compiler = new Compiler();
        compiler.setDebug(debug || config.getBoolean("compiler.debug"));
        if (verbose.length > 0) {
            int verbosity = CompilerLogger.NORMAL + verbose.length;
            compiler.setVerbosity(verbosity);
            LoggingConfigurator.setLevel("org.rpncompiler.compiler",
                    verbosity >= CompilerLogger.TRACE ? Level.TRACE : Level.DEBUG);
        }
        ProgramArtifact artifact;
        try {
            artifact = compiler.compile(expression, config.getString("compiler.program-name"));
        } catch (CompilationException e) {
            err.println("Error compiling: " + e.getMessage());
            return 1;
        }

        if (emitFile != null) {
            try {
                Files.writeString(emitFile, artifact.assembly(), StandardCharsets.UTF_8);
                LOG.info("Wrote assembly to {}", emitFile);
            } catch (IOException e) {
                err.println("Error writing " + emitFile + ": " + e.getMessage());
                return 1;
            }
        }

        if (!assemble && !run) {
            if (emitFile == null) {
                out.print(artifact.assembly());
                out.flush();
            }
            return 0;
        }

        Path executable = output != null ? output : Path.of(config.getString("toolchain.output"));
        IToolchain toolchain = parent.createToolchain();
        try {
            toolchain.assemble(artifact.assembly(), executable);
            if (!run) {
                return 0;
            }
            ExecutionResult result = toolchain.run(executable);
            out.print(result.output());
            out.flush();
            return result.exitCode();
        } catch (ToolchainException e) {
            err.println("Error launching toolchain: " + e.getMessage());
            return 1;
        }
    }
}
