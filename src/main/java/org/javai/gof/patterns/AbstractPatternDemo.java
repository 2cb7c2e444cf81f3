package org.javai.gof.patterns;

import org.javai.gof.DemoContext;
import org.javai.gof.PatternDemo;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Base class for the bundled demos: holds the display name, description and the
 * {@link DemoContext} narration is printed to.
 */
public abstract class AbstractPatternDemo implements PatternDemo {

    private final String name;
    private final String description;

    protected final DemoContext context;
    protected final PrintStream out;

    protected AbstractPatternDemo(DemoContext context, String name, String description) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.out = context.out();
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String description() {
        return description;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
