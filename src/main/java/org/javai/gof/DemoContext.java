package org.javai.gof;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;

/**
 * What a demo needs from its surroundings: where to print, and how long to pause when it
 * simulates slow work (loading an image, waiting for a scheduled command).
 *
 * @param out Narration output
 * @param delay Length of one simulated delay; zero disables delays
 */
public record DemoContext(PrintStream out, Duration delay) {

    public DemoContext {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public static DemoContext of(PrintStream out, DemoSettings settings) {
        return new DemoContext(out, settings.pause());
    }

    /**
     * A context without delays, for tests and scripted runs.
     */
    public static DemoContext immediate(PrintStream out) {
        return new DemoContext(out, Duration.ZERO);
    }

    /**
     * Sleeps for one delay.
     */
    public void pause() throws InterruptedException {
        pause(1);
    }

    /**
     * Sleeps for {@code times} delays.
     *
     * @throws ArithmeticException if the total delay does not fit in a {@code long} of millis
     */
    public void pause(int times) throws InterruptedException {
        if (!delay.isZero() && times > 0) {
            Thread.sleep(delay.multipliedBy(times).toMillis());
        }
    }
}
