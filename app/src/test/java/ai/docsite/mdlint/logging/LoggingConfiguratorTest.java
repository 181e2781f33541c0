package ai.docsite.mdlint.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.mdlint.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextLogging() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void switchesToJsonAndDebug() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getLogger(LoggingConfigurator.ENGINE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        OutputStreamAppender<ILoggingEvent> console = console(context);
        assertThat(console.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) console.getEncoder()).getLayout())
                .isInstanceOf(SimpleJsonLayout.class);
        assertThat(console.isStarted()).isTrue();
    }

    @Test
    void switchesBackToText() {
        LoggingConfigurator.configure(LogFormat.JSON, true);
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getLogger(LoggingConfigurator.ENGINE_LOGGER).getLevel()).isEqualTo(Level.INFO);
        assertThat(console(context).getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
    }

    private static OutputStreamAppender<ILoggingEvent> console(LoggerContext context) {
        return (OutputStreamAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE");
    }
}
