package org.rpncompiler.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the effective rpnc configuration from layered HOCON sources. Highest precedence first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties, e.g. {@code -Dtoolchain.command=clang}</li>
 *   <li>the file given with {@code --config}, otherwise {@value #CONFIG_FILE_NAME} in the working directory</li>
 *   <li>{@code reference.conf} from the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "rpnc.conf";

    private ConfigLoader() {}

    /**
     * @param explicitFile A configuration file chosen by the user, or {@code null}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if {@code explicitFile} does not exist.
     */
    public static Config load(final File explicitFile) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileLayer(explicitFile))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    private static Config fileLayer(final File explicitFile) {
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file {}", explicitFile.getAbsolutePath());
            return ConfigFactory.parseFile(explicitFile);
        }
        final File local = new File(CONFIG_FILE_NAME);
        if (!local.isFile()) {
            LOG.debug("No {} in the working directory, using defaults", CONFIG_FILE_NAME);
            return ConfigFactory.empty();
        }
        LOG.debug("Using configuration file {}", local.getAbsolutePath());
        return ConfigFactory.parseFile(local);
    }
}
