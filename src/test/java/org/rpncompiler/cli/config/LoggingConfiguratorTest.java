package org.rpncompiler.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.rpncompiler.toolchain").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.rpncompiler.toolchain" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.rpncompiler.toolchain").getLevel());
    }

    @Test
    void configure_shouldIgnoreUnknownLevels() {
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.rpncompiler.toolchain" = "LOUD" }
            """);

        LoggingConfigurator.configure(config);

        assertNull(context.getLogger("org.rpncompiler.toolchain").getLevel());
    }

    @Test
    void configure_isAppliedOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));
        assertEquals(Level.TRACE, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void reset_shouldRestorePreviousLevels() {
        final Level before = context.getLogger("org.rpncompiler.compiler").getLevel();
        LoggingConfigurator.setLevel("org.rpncompiler.compiler", Level.TRACE);
        assertEquals(Level.TRACE, context.getLogger("org.rpncompiler.compiler").getLevel());

        LoggingConfigurator.reset();

        assertEquals(before, context.getLogger("org.rpncompiler.compiler").getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldKeepLevels() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
