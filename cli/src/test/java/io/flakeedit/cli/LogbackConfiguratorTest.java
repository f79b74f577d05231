package io.flakeedit.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private static Logger rootLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @AfterEach
    void restoreQuietDefault() {
        LogbackConfigurator.configure(false);
    }

    @Test
    void verboseLogsDebug() {
        LogbackConfigurator.configure(true);

        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quietByDefault() {
        LogbackConfigurator.configure(false);

        assertThat(rootLogger().getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void singleStderrAppenderWithTextPattern() {
        LogbackConfigurator.configure(false);
        LogbackConfigurator.configure(false);

        var appender = rootLogger().getAppender("STDERR");
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        ConsoleAppender<?> console = (ConsoleAppender<?>) appender;
        assertThat(console.getTarget()).isEqualTo("System.err");
        assertThat(((PatternLayoutEncoder) console.getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN);
        assertThat(rootLogger().iteratorForAppenders()).toIterable().hasSize(1);
    }
}
