package org.javai.gof.boundary;

import org.javai.gof.FailureKind;

/**
 * Classifies exceptions thrown by demo code into structured failures.
 * Implementations should be deterministic.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a FailureKind.
     *
     * @param operation The variant being constructed or the demo being run
     * @param throwable The exception that occurred
     * @return A classified FailureKind
     */
    FailureKind classify(String operation, Throwable throwable);

    /**
     * The classifier used when none is configured.
     */
    static FailureClassifier defaults() {
        return new DefaultFailureClassifier();
    }
}
