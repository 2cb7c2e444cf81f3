package org.javai.gof.boundary;

import org.javai.gof.Cause;
import org.javai.gof.FailureKind;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Default classifier for the exceptions demo code tends to throw.
 *
 * <p>The failure message is the exception's own message (or its class name when it has
 * none), so the user sees exactly what the demo reported. The code carries the
 * classification. Wrapped causes from reflection or static initialization are
 * classified by their root exception.
 */
public class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public FailureKind classify(String operation, Throwable thrown) {
        Throwable t = Cause.unwrap(thrown);
        Cause cause = Cause.fromThrowable(t);

        if (t instanceof NullPointerException) {
            return demo("null_pointer", t, cause);
        }

        if (t instanceof NumberFormatException || t instanceof IllegalArgumentException) {
            return demo("illegal_argument", t, cause);
        }

        if (t instanceof IllegalStateException) {
            return demo("illegal_state", t, cause);
        }

        if (t instanceof UnsupportedOperationException) {
            return demo("unsupported_operation", t, cause);
        }

        if (t instanceof IndexOutOfBoundsException) {
            return demo("index_out_of_bounds", t, cause);
        }

        if (t instanceof ClassCastException) {
            return demo("class_cast", t, cause);
        }

        if (t instanceof ArithmeticException) {
            return demo("arithmetic", t, cause);
        }

        if (t instanceof InterruptedException) {
            return demo("interrupted", t, cause);
        }

        if (t instanceof LinkageError) {
            return demo("linkage", t, cause);
        }

        if (t instanceof IOException || t instanceof UncheckedIOException) {
            return new FailureKind("io", "io_error", messageOf(t), cause);
        }

        // Fallback for anything else a demo may throw
        return new FailureKind("unknown", t.getClass().getSimpleName(), messageOf(t), cause);
    }

    private static FailureKind demo(String name, Throwable t, Cause cause) {
        return new FailureKind("demo", name, messageOf(t), cause);
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
