package org.rpncompiler.toolchain;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link IToolchain} backed by gcc. The assembly is piped to
 * {@code gcc <flags> -o <output> -x assembler -}.
 * <p>
 * Configuration:
 * <pre>
 * toolchain {
 *   command = "gcc"
 *   flags = ["-static"]
 *   timeout = 30s
 * }
 * </pre>
 */
public class GccToolchain implements IToolchain {

    private static final Logger LOG = LoggerFactory.getLogger(GccToolchain.class);

    private final String command;
    private final List<String> flags;
    private final Duration timeout;

    /**
     * @param command The gcc executable.
     * @param flags Extra flags placed before the output option.
     * @param timeout Upper bound for assembling and for running a program.
     */
    public GccToolchain(String command, List<String> flags, Duration timeout) {
        this.command = command;
        this.flags = List.copyOf(flags);
        this.timeout = timeout;
    }

    /**
     * @param config The application configuration containing a {@code toolchain} block.
     * @return A toolchain configured from it.
     */
    public static GccToolchain fromConfig(Config config) {
        Config tc = config.getConfig("toolchain");
        return new GccToolchain(tc.getString("command"), tc.getStringList("flags"), tc.getDuration("timeout"));
    }

    @Override
    public void assemble(String assembly, Path output) throws ToolchainException {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.addAll(flags);
        cmd.add("-o");
        cmd.add(output.toString());
        cmd.add("-x");
        cmd.add("assembler");
        cmd.add("-");
        LOG.debug("Assembling with: {}", String.join(" ", cmd));

        ExecutionResult result = execute(new ProcessBuilder(cmd), assembly);
        if (result.exitCode() != 0) {
            throw new ToolchainException(command + " exited with status " + result.exitCode() + ":\n" + result.output());
        }
        LOG.info("Wrote executable {}", output);
    }

    @Override
    public ExecutionResult run(Path executable) throws ToolchainException {
        Path target = executable.isAbsolute() || executable.getParent() != null
                ? executable
                : Path.of(".").resolve(executable);
        LOG.debug("Running {}", target);
        return execute(new ProcessBuilder(target.toString()), null);
    }

    /**
     * Runs a process to completion or until the timeout. Its stdout and stderr go to a
     * temporary file that is only read once the process has ended.
     */
    private ExecutionResult execute(ProcessBuilder builder, String input) throws ToolchainException {
        String name = builder.command().get(0);
        Path capture;
        try {
            capture = Files.createTempFile("rpnc-", ".out");
        } catch (IOException e) {
            throw new ToolchainException("Failed to create a capture file for " + name, e);
        }
        try {
            builder.redirectErrorStream(true).redirectOutput(capture.toFile());
            Process process = start(builder);
            try (OutputStream stdin = process.getOutputStream()) {
                if (input != null) {
                    stdin.write(input.getBytes(StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                process.destroyForcibly();
                throw new ToolchainException("Failed to pass the program to " + name, e);
            }
            int exitCode = await(process, name);
            return new ExecutionResult(exitCode, readCapture(capture));
        } finally {
            try {
                Files.deleteIfExists(capture);
            } catch (IOException e) {
                LOG.warn("Could not delete {}: {}", capture, e.getMessage());
            }
        }
    }

    private Process start(ProcessBuilder builder) throws ToolchainException {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new ToolchainException("Failed to launch " + builder.command().get(0) + ": " + e.getMessage(), e);
        }
    }

    private int await(Process process, String name) throws ToolchainException {
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolchainException(name + " did not finish within " + timeout);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ToolchainException("Interrupted while waiting for " + name, e);
        }
    }

    private static String readCapture(Path capture) throws ToolchainException {
        try {
            return Files.readString(capture, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolchainException("Failed to read process output", e);
        }
    }
}
