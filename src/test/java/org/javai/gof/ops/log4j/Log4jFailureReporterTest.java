package org.javai.gof.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.gof.Cause;
import org.javai.gof.Failure;
import org.javai.gof.FailureKind;
import org.javai.gof.FailureStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Log4jFailureReporterTest {

    private static final String LOGGER_NAME = "org.javai.gof.test.CapturedFailures";

    private Logger logger;
    private CapturingAppender appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LogManager.getLogger(LOGGER_NAME);
        appender = new CapturingAppender();
        appender.start();
        logger.addAppender(appender);
        logger.setAdditive(false);
        logger.setLevel(Level.ALL);
    }

    @AfterEach
    void tearDown() {
        logger.removeAppender(appender);
        appender.stop();
    }

    private static Failure failure(FailureStage stage, Map<String, String> tags, Cause cause) {
        return new Failure(
                new FailureKind("demo", "illegal_state", "light stuck", cause),
                stage, "State", Instant.now(), tags);
    }

    @Test
    void formatFailureMessage_includesSortedTagsAndCause() {
        Cause cause = new Cause("java.lang.IllegalStateException", "org.example.Light.next:42", "light stuck");
        Failure failure = failure(FailureStage.DEMONSTRATION, Map.of("demo", "State", "attempt", "1"), cause);

        assertThat(Log4jFailureReporter.formatFailureMessage(failure)).isEqualTo(
                "DEMONSTRATION failed for [State]: light stuck | code=demo:illegal_state"
                        + ", tags={attempt=1, demo=State}"
                        + ", cause=java.lang.IllegalStateException at org.example.Light.next:42");
    }

    @Test
    void formatFailureMessage_withoutTagsOrCause() {
        Failure failure = failure(FailureStage.CONSTRUCTION, null, null);

        assertThat(Log4jFailureReporter.formatFailureMessage(failure))
                .isEqualTo("CONSTRUCTION failed for [State]: light stuck | code=demo:illegal_state");
    }

    @Test
    void report_constructionFailure_logsWarnWithMarker() {
        new Log4jFailureReporter(LOGGER_NAME).report(failure(FailureStage.CONSTRUCTION, null, null));

        assertThat(appender.events).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getMarker().getName()).isEqualTo("DEMO_FAILURE");
            assertThat(event.getMessage().getFormattedMessage()).startsWith("CONSTRUCTION failed for [State]");
        });
    }

    @Test
    void report_demonstrationFailure_logsError() {
        new Log4jFailureReporter(LOGGER_NAME).report(failure(FailureStage.DEMONSTRATION, null, null));

        assertThat(appender.events).singleElement()
                .satisfies(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR));
    }

    private static final class CapturingAppender extends AbstractAppender {
        private final List<LogEvent> events = new ArrayList<>();

        CapturingAppender() {
            super("Capturing", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }
}
