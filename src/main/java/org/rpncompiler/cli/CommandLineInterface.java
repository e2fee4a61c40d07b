package org.rpncompiler.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.rpncompiler.cli.commands.CompileCommand;
import org.rpncompiler.cli.config.ConfigLoader;
import org.rpncompiler.cli.config.LoggingConfigurator;
import org.rpncompiler.toolchain.GccToolchain;
import org.rpncompiler.toolchain.IToolchain;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "rpnc",
    mixinStandardHelpOptions = true,
    version = "rpnc 1.0",
    description = "Compiles reverse-Polish-notation expressions to x86-64 assembly",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private final Function<Config, IToolchain> toolchainFactory;
    private Config config;

    public CommandLineInterface() {
        this(GccToolchain::fromConfig);
    }

    /**
     * @param toolchainFactory Creates the toolchain used to assemble and run programs.
     */
    public CommandLineInterface(Function<Config, IToolchain> toolchainFactory) {
        this.toolchainFactory = toolchainFactory;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException | IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public IToolchain createToolchain() {
        return toolchainFactory.apply(getConfig());
    }
}
