package org.javai.gof.ops;

import org.javai.gof.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link FailureReporter} that delegates to multiple reporters.
 *
 * <p>Every reporter receives every failure. If one throws, the error is logged and the
 * remaining reporters still run.
 *
 * <pre>{@code
 * FailureReporter reporter = CompositeFailureReporter.builder()
 *     .add(new ConsoleWarningReporter(System.out))
 *     .add(new Log4jFailureReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeFailureReporter implements FailureReporter {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeFailureReporter.class);

    private final List<FailureReporter> reporters;

    private CompositeFailureReporter(List<FailureReporter> reporters) {
        this.reporters = List.copyOf(reporters);
    }

    public static CompositeFailureReporter of(FailureReporter... reporters) {
        return new CompositeFailureReporter(Arrays.asList(reporters));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void report(Failure failure) {
        for (FailureReporter reporter : reporters) {
            try {
                reporter.report(failure);
            } catch (RuntimeException e) {
                LOG.error("FailureReporter {} failed while reporting {} of [{}]",
                        reporter.getClass().getName(), failure.stage(), failure.operation(), e);
            }
        }
    }

    /**
     * Returns the number of reporters in this composite.
     */
    public int size() {
        return reporters.size();
    }

    /**
     * Builder for creating a {@link CompositeFailureReporter}.
     */
    public static final class Builder {
        private final List<FailureReporter> reporters = new ArrayList<>();

        private Builder() {}

        /**
         * Adds a reporter; null is ignored.
         */
        public Builder add(FailureReporter reporter) {
            if (reporter != null) {
                reporters.add(reporter);
            }
            return this;
        }

        public Builder addIf(boolean condition, FailureReporter reporter) {
            if (condition) {
                add(reporter);
            }
            return this;
        }

        public CompositeFailureReporter build() {
            return new CompositeFailureReporter(reporters);
        }
    }
}
