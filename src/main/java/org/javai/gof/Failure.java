package org.javai.gof;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-contextualized demo failure ready for reporting.
 *
 * @param kind What went wrong (code, message, cause)
 * @param stage Construction or demonstration
 * @param operation The variant being constructed, or the demo being run
 * @param occurredAt When the failure happened
 * @param tags Additional key-value metadata for logging
 */
public record Failure(
        FailureKind kind,
        FailureStage stage,
        String operation,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public String code() {
        return kind.code();
    }

    public String message() {
        return kind.message();
    }

    public Cause cause() {
        return kind.cause();
    }
}
