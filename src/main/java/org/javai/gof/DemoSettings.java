package org.javai.gof;

import java.time.Duration;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Runtime settings, resolved from a system property first, then an environment variable,
 * then a default.
 *
 * <ul>
 *   <li>{@code gof.console.clear} / {@code GOF_CONSOLE_CLEAR}: clear the screen between views (default true)</li>
 *   <li>{@code gof.demo.pause.millis} / {@code GOF_DEMO_PAUSE_MILLIS}: simulated delay in demos (default 500, at most 60000)</li>
 * </ul>
 *
 * @param clearScreen whether views start by clearing the terminal
 * @param pause the delay demos use to simulate slow work
 */
public record DemoSettings(boolean clearScreen, Duration pause) {

    public static final String CLEAR_SCREEN_PROPERTY = "gof.console.clear";
    public static final String CLEAR_SCREEN_ENV = "GOF_CONSOLE_CLEAR";
    public static final String PAUSE_PROPERTY = "gof.demo.pause.millis";
    public static final String PAUSE_ENV = "GOF_DEMO_PAUSE_MILLIS";

    static final long DEFAULT_PAUSE_MILLIS = 500;
    static final long MAX_PAUSE_MILLIS = 60_000;

    public DemoSettings {
        Objects.requireNonNull(pause, "pause must not be null");
    }

    public static DemoSettings defaults() {
        return new DemoSettings(true, Duration.ofMillis(DEFAULT_PAUSE_MILLIS));
    }

    public static DemoSettings fromEnvironment() {
        return resolve(System::getenv);
    }

    /**
     * Resolves settings against system properties and the given environment lookup.
     */
    static DemoSettings resolve(UnaryOperator<String> env) {
        String clear = resolveConfig(CLEAR_SCREEN_PROPERTY, CLEAR_SCREEN_ENV, env);
        String pauseMillis = resolveConfig(PAUSE_PROPERTY, PAUSE_ENV, env);

        boolean clearScreen = clear == null || Boolean.parseBoolean(clear.trim());
        Duration pause = pauseMillis == null
                ? Duration.ofMillis(DEFAULT_PAUSE_MILLIS)
                : Duration.ofMillis(parseMillis(pauseMillis));
        return new DemoSettings(clearScreen, pause);
    }

    private static String resolveConfig(String sysProp, String envVar, UnaryOperator<String> env) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = env.apply(envVar);
        }
        return value == null || value.isBlank() ? null : value;
    }

    private static long parseMillis(String value) {
        long millis;
        try {
            millis = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw invalidPause(value);
        }
        if (millis < 0 || millis > MAX_PAUSE_MILLIS) {
            throw invalidPause(value);
        }
        return millis;
    }

    private static IllegalStateException invalidPause(String value) {
        return new IllegalStateException(
                "Invalid configuration: system property '" + PAUSE_PROPERTY +
                "' or environment variable '" + PAUSE_ENV +
                "' must be between 0 and " + MAX_PAUSE_MILLIS + " milliseconds, got '" + value + "'"
        );
    }
}
