package org.javai.gof;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/**
 * Diagnostic details of the exception behind a failure.
 *
 * <p>Wrappers that only carry another exception ({@link InvocationTargetException},
 * {@link ExceptionInInitializerError}) are unwrapped, so a demo whose static initializer
 * throws is described by the exception it actually threw.
 *
 * @param type The class name of the root exception
 * @param origin Where it was thrown ({@code Class.method:line}), or "unknown"
 * @param detail The root exception's message (may be null)
 */
public record Cause(String type, String origin, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    public static Cause fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        Throwable root = unwrap(t);
        return new Cause(root.getClass().getName(), originOf(root), root.getMessage());
    }

    /**
     * Strips reflective and initializer wrappers from {@code t}.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof InvocationTargetException || current instanceof ExceptionInInitializerError)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String originOf(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return "unknown";
        }
        StackTraceElement top = stack[0];
        return top.getClassName() + "." + top.getMethodName() + ":" + top.getLineNumber();
    }
}
