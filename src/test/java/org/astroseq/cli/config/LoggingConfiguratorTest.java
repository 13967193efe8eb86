package org.astroseq.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        context.getLogger("org.astroseq.io").setLevel(null);
        context.getLogger("org.astroseq.engine.writer").setLevel(null);
    }

    @Test
    void appliesQuotedAndNestedLoggerNames() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.astroseq.io\" = DEBUG\n org.astroseq.engine.writer = ERROR }"));

        assertThat(context.getLogger("org.astroseq.io").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.astroseq.engine.writer").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void rejectsUnknownLevel() {
        assertThatThrownBy(() -> LoggingConfigurator.configure(
                ConfigFactory.parseResources(LoggingConfiguratorTest.class, "invalid-levels.conf")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid log level 'LOUD' for logger 'org.astroseq.io'");
    }

    @Test
    void ignoresConfigWithoutLevels() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger("org.astroseq.io").getLevel()).isNull();
    }

    @Test
    void joinsConfigPathIntoLoggerName() {
        assertThat(LoggingConfigurator.loggerName("\"org.astroseq.io\"")).isEqualTo("org.astroseq.io");
        assertThat(LoggingConfigurator.loggerName("org.astroseq.io")).isEqualTo("org.astroseq.io");
    }
}
