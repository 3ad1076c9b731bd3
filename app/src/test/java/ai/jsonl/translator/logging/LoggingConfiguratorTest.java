package ai.jsonl.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.jsonl.translator.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaults() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void switchesRootAppendersToJson() {
        LoggingConfigurator.configure(LogFormat.JSON, false);

        assertThat(outputStreamAppenders()).isNotEmpty().allSatisfy(appender -> {
            assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
            assertThat(((LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder()).getLayout())
                    .isInstanceOf(JsonLogLayout.class);
            assertThat(appender.isStarted()).isTrue();
        });
    }

    @Test
    void textFormatUsesTimestampPattern() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(outputStreamAppenders()).isNotEmpty().allSatisfy(appender ->
                assertThat(appender.getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                        encoder -> assertThat(encoder.getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN)));
    }

    @Test
    void verboseEnablesDebugForApplicationLoggers() {
        LoggingConfigurator.configure(LogFormat.TEXT, true);
        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.configure(LogFormat.TEXT, false);
        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.INFO);
    }

    private List<OutputStreamAppender<ILoggingEvent>> outputStreamAppenders() {
        List<OutputStreamAppender<ILoggingEvent>> appenders = new ArrayList<>();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> outputStreamAppender) {
                appenders.add(outputStreamAppender);
            }
        }
        return appenders;
    }
}
