package org.javai.gof.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.gof.Cause;
import org.javai.gof.Failure;
import org.javai.gof.FailureStage;
import org.javai.gof.ops.FailureReporter;

import java.util.Map;

/**
 * Reports demo failures using Log4j2 structured logging.
 *
 * <p>Log levels follow the failure's {@link FailureStage}:
 * <ul>
 *   <li>{@code CONSTRUCTION} → WARN (the demo is skipped, the catalog carries on)</li>
 *   <li>{@code DEMONSTRATION} → ERROR</li>
 * </ul>
 */
public class Log4jFailureReporter implements FailureReporter {

    static final String DEFAULT_LOGGER_NAME = "org.javai.gof.DemoFailures";

    private static final Marker FAILURE_MARKER = MarkerManager.getMarker("DEMO_FAILURE");

    private final Logger logger;

    public Log4jFailureReporter() {
        this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
    }

    public Log4jFailureReporter(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public Log4jFailureReporter(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(Failure failure) {
        logger.atLevel(levelFor(failure.stage()))
                .withMarker(FAILURE_MARKER)
                .log(formatFailureMessage(failure));
    }

    static String formatFailureMessage(Failure failure) {
        return "%s failed for [%s]: %s | code=%s%s%s".formatted(
                failure.stage(),
                failure.operation(),
                failure.message(),
                failure.code(),
                formatTags(failure.tags()),
                formatCause(failure.cause())
        );
    }

    private static String formatTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return ", tags={" + tags.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .reduce((a, b) -> a + ", " + b)
                .orElse("") + "}";
    }

    private static String formatCause(Cause cause) {
        return cause != null ? ", cause=" + cause.type() + " at " + cause.origin() : "";
    }

    private static Level levelFor(FailureStage stage) {
        return switch (stage) {
            case CONSTRUCTION -> Level.WARN;
            case DEMONSTRATION -> Level.ERROR;
        };
    }
}
