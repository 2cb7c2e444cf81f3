package org.javai.gof.boundary;

import org.javai.gof.Failure;
import org.javai.gof.FailureKind;
import org.javai.gof.FailureStage;
import org.javai.gof.Outcome;
import org.javai.gof.PatternDemo;
import org.javai.gof.ops.FailureReporter;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * The boundary between the menu and demo code.
 * Catches whatever a demo throws, classifies it into a failure, reports it, and returns an
 * {@link Outcome}.
 *
 * <p>This is the single point where exceptions from demos are translated into values. A
 * failing demo, whether it fails while being constructed or while running, never takes
 * the catalog or the menu loop down with it. {@link VirtualMachineError}s are the only
 * exception: they propagate.</p>
 *
 * <pre>{@code
 * DemoBoundary boundary = DemoBoundary.withReporter(reporter);
 *
 * Outcome<PatternDemo> demo = boundary.construct("FacadeDemo", () -> new FacadeDemo(context));
 * Outcome<Void> run = boundary.demonstrate(demo.getOrThrow());
 * }</pre>
 */
public final class DemoBoundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = FailureClassifier.defaults();

    private final FailureClassifier classifier;
    private final FailureReporter reporter;

    /**
     * Creates a boundary that classifies failures but does not report them.
     */
    public static DemoBoundary silent() {
        return new DemoBoundary(DEFAULT_CLASSIFIER, FailureReporter.noOp());
    }

    /**
     * Creates a boundary with default classification and the specified reporter.
     */
    public static DemoBoundary withReporter(FailureReporter reporter) {
        return new DemoBoundary(DEFAULT_CLASSIFIER, reporter);
    }

    public static DemoBoundary of(FailureClassifier classifier, FailureReporter reporter) {
        return new DemoBoundary(classifier, reporter);
    }

    public DemoBoundary(FailureClassifier classifier, FailureReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Instantiates one demo variant.
     *
     * @param variant The variant's identifying name, used in warnings
     * @param factory Creates the demo; may throw
     * @return Ok with the demo, or Fail if the factory threw or returned null
     */
    public Outcome<PatternDemo> construct(String variant, Callable<? extends PatternDemo> factory) {
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(factory, "factory must not be null");

        return call(FailureStage.CONSTRUCTION, variant, Map.of("variant", variant), () -> {
            PatternDemo demo = factory.call();
            if (demo == null) {
                throw new IllegalStateException("factory for " + variant + " returned null");
            }
            return demo;
        });
    }

    /**
     * Runs a demo's action.
     *
     * @return Ok when the demonstration completed, or Fail describing what it threw
     */
    public Outcome<Void> demonstrate(PatternDemo demo) {
        Objects.requireNonNull(demo, "demo must not be null");

        return call(FailureStage.DEMONSTRATION, demo.name(), Map.of("demo", demo.name()), () -> {
            demo.demonstrate();
            return null;
        });
    }

    private <T> Outcome<T> call(FailureStage stage, String operation, Map<String, String> tags, Callable<T> work) {
        try {
            return Outcome.ok(work.call());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(stage, operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(FailureStage stage, String operation, Map<String, String> tags, Throwable e) {
        FailureKind kind = classifier.classify(operation, e);
        Failure failure = new Failure(kind, stage, operation, Instant.now(), tags);

        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
