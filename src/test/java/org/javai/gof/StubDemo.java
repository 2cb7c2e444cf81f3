package org.javai.gof;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A configurable demo for catalog, boundary and menu tests.
 */
public final class StubDemo implements PatternDemo {

    private final String name;
    private final String description;
    private final Callable<?> action;
    private final AtomicInteger runs = new AtomicInteger();

    public StubDemo(String name, String description, Callable<?> action) {
        this.name = name;
        this.description = description;
        this.action = action;
    }

    public static StubDemo named(String name) {
        return new StubDemo(name, name + " description", () -> null);
    }

    public static StubDemo failing(String name, Exception failure) {
        return new StubDemo(name, name + " description", () -> {
            throw failure;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public void demonstrate() throws Exception {
        runs.incrementAndGet();
        action.call();
    }

    public int runs() {
        return runs.get();
    }
}
