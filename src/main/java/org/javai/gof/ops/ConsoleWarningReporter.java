package org.javai.gof.ops;

import org.javai.gof.Failure;
import org.javai.gof.FailureStage;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Tells the user on the console which demos could not be created.
 *
 * <p>Only {@link FailureStage#CONSTRUCTION} failures are printed here. Demonstration failures
 * are shown inline by the menu, right under the demo's header.
 */
public class ConsoleWarningReporter implements FailureReporter {

    private final PrintStream out;

    public ConsoleWarningReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void report(Failure failure) {
        if (failure.stage() == FailureStage.CONSTRUCTION) {
            out.println("Warning: Could not create instance of " + failure.operation() + ": " + failure.message());
        }
    }
}
