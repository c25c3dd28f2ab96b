package org.drinkmap.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.drinkmap.junit.extensions.logging.ExpectLog;
import org.drinkmap.junit.extensions.logging.LogLevel;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.drinkmap.test.configured";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        rootLevel = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LOGGER_NAME).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesFormatAndLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              format = "plain"
              default-level = "WARN"
              levels { "org.drinkmap.test.configured" = "TRACE" }
            }
            """));

        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void configuresOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.drinkmap.test.configured\" = DEBUG }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.drinkmap.test.configured\" = ERROR }"));

        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.drinkmap.test.configured\" = ERROR }"));

        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.drinkmap.test.configured'")
    void unknownLevelsAreIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.drinkmap.test.configured\" = LOUD }"));

        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isNull();
    }

    @Test
    void jsonIsTheDefaultFormat() {
        assertThat(LoggingConfigurator.appenderFor("JSON")).isEqualTo("STDOUT");
        assertThat(LoggingConfigurator.appenderFor("anything")).isEqualTo("STDOUT");
        assertThat(LoggingConfigurator.appenderFor("Plain")).isEqualTo("STDOUT_PLAIN");
    }
}
