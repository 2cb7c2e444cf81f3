package org.javai.gof.ops;

import org.javai.gof.Failure;

/**
 * Reports demo failures for the user and for the log.
 */
@FunctionalInterface
public interface FailureReporter {

    /**
     * Reports a failure occurrence.
     */
    void report(Failure failure);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static FailureReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static FailureReporter composite(FailureReporter... reporters) {
        return CompositeFailureReporter.of(reporters);
    }
}
