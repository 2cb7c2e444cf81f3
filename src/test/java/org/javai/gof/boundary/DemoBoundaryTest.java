package org.javai.gof.boundary;

import org.javai.gof.Failure;
import org.javai.gof.FailureStage;
import org.javai.gof.Outcome;
import org.javai.gof.PatternDemo;
import org.javai.gof.StubDemo;
import org.javai.gof.ops.FailureReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DemoBoundaryTest {

    private DemoBoundary boundary;
    private List<Failure> reportedFailures;

    @BeforeEach
    void setUp() {
        reportedFailures = new ArrayList<>();
        FailureReporter reporter = reportedFailures::add;
        boundary = new DemoBoundary(new DefaultFailureClassifier(), reporter);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void construct_success_returnsOk() {
        StubDemo demo = StubDemo.named("Facade");

        Outcome<PatternDemo> result = boundary.construct("FacadeDemo", () -> demo);

        assertThat(result.isOk()).isTrue();
        assertThat(result.getOrThrow()).isSameAs(demo);
        assertThat(reportedFailures).isEmpty();
    }

    @Test
    void construct_factoryThrows_returnsFailAndReports() {
        Outcome<PatternDemo> result = boundary.construct("BrokenDemo", () -> {
            throw new IllegalArgumentException("no default constructor");
        });

        assertThat(result.isFail()).isTrue();
        assertThat(reportedFailures).hasSize(1);

        Failure failure = reportedFailures.get(0);
        assertThat(failure.stage()).isEqualTo(FailureStage.CONSTRUCTION);
        assertThat(failure.operation()).isEqualTo("BrokenDemo");
        assertThat(failure.code()).isEqualTo("demo:illegal_argument");
        assertThat(failure.message()).isEqualTo("no default constructor");
        assertThat(failure.tags()).containsEntry("variant", "BrokenDemo");
    }

    @Test
    void construct_factoryReturnsNull_isIllegalState() {
        Outcome<PatternDemo> result = boundary.construct("NullDemo", () -> null);

        assertThat(result.isFail()).isTrue();
        assertThat(reportedFailures).singleElement()
                .satisfies(f -> {
                    assertThat(f.code()).isEqualTo("demo:illegal_state");
                    assertThat(f.message()).isEqualTo("factory for NullDemo returned null");
                });
    }

    @Test
    void construct_checkedException_isIoFailure() {
        Outcome<PatternDemo> result = boundary.construct("DiskDemo", () -> {
            throw new IOException("disk error");
        });

        assertThat(result.isFail()).isTrue();
        assertThat(reportedFailures.get(0).code()).isEqualTo("io:io_error");
    }

    @Test
    void construct_staticInitializerFailure_isClassifiedByRootCause() {
        Outcome<PatternDemo> result = boundary.construct("InitDemo", () -> {
            throw new ExceptionInInitializerError(new ArithmeticException("/ by zero"));
        });

        assertThat(result.isFail()).isTrue();
        Failure failure = reportedFailures.get(0);
        assertThat(failure.code()).isEqualTo("demo:arithmetic");
        assertThat(failure.message()).isEqualTo("/ by zero");
        assertThat(failure.cause().type()).isEqualTo(ArithmeticException.class.getName());
    }

    @Test
    void demonstrate_success_returnsOkWithoutReporting() {
        StubDemo demo = StubDemo.named("Observer");

        Outcome<Void> result = boundary.demonstrate(demo);

        assertThat(result.isOk()).isTrue();
        assertThat(demo.runs()).isEqualTo(1);
        assertThat(reportedFailures).isEmpty();
    }

    @Test
    void demonstrate_throws_returnsFailWithDemoName() {
        StubDemo demo = StubDemo.failing("State", new IllegalStateException("light stuck"));

        Outcome<Void> result = boundary.demonstrate(demo);

        assertThat(result.isFail()).isTrue();
        Failure failure = reportedFailures.get(0);
        assertThat(failure.stage()).isEqualTo(FailureStage.DEMONSTRATION);
        assertThat(failure.operation()).isEqualTo("State");
        assertThat(failure.message()).isEqualTo("light stuck");
        assertThat(failure.tags()).containsEntry("demo", "State");
    }

    @Test
    void demonstrate_error_isCaught() {
        StubDemo demo = new StubDemo("Visitor", "d", () -> {
            throw new AssertionError("unreachable shape");
        });

        Outcome<Void> result = boundary.demonstrate(demo);

        assertThat(result.isFail()).isTrue();
        assertThat(reportedFailures.get(0).code()).isEqualTo("unknown:AssertionError");
    }

    @Test
    void demonstrate_interrupted_restoresInterruptFlag() {
        StubDemo demo = StubDemo.failing("Proxy", new InterruptedException("stop"));

        Outcome<Void> result = boundary.demonstrate(demo);

        assertThat(result.isFail()).isTrue();
        assertThat(reportedFailures.get(0).code()).isEqualTo("demo:interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void demonstrate_virtualMachineError_propagates() {
        StubDemo demo = new StubDemo("Flyweight", "d", () -> {
            throw new OutOfMemoryError("simulated");
        });

        assertThatThrownBy(() -> boundary.demonstrate(demo))
                .isInstanceOf(OutOfMemoryError.class)
                .hasMessage("simulated");
        assertThat(reportedFailures).isEmpty();
    }

    @Test
    void silent_classifiesWithoutReporting() {
        Outcome<Void> result = DemoBoundary.silent()
                .demonstrate(StubDemo.failing("Memento", new UnsupportedOperationException("no undo")));

        assertThat(result.isFail()).isTrue();
        result.onFailure(f -> assertThat(f.code()).isEqualTo("demo:unsupported_operation"));
    }

    @Test
    void customClassifier_isUsed() {
        FailureClassifier classifier = (operation, t) ->
                new org.javai.gof.FailureKind("custom", "always", operation + " failed", null);
        DemoBoundary custom = DemoBoundary.of(classifier, reportedFailures::add);

        custom.demonstrate(StubDemo.failing("Bridge", new RuntimeException("x")));

        assertThat(reportedFailures.get(0).code()).isEqualTo("custom:always");
        assertThat(reportedFailures.get(0).message()).isEqualTo("Bridge failed");
    }
}
