package org.javai.gof;

/**
 * A self-contained demonstration of one design pattern.
 *
 * <p>The catalog and the menu depend on nothing else about a demo: it has a display name
 * (used for sorting and menu labels), a description, and an action that narrates the
 * pattern at work. The action may throw anything; callers run it through
 * {@link org.javai.gof.boundary.DemoBoundary}.
 */
public interface PatternDemo {

    /**
     * The display name, e.g. "Abstract Factory". Never empty.
     */
    String name();

    /**
     * What the pattern does and when to use it.
     */
    String description();

    /**
     * Runs the demonstration, printing its narration.
     *
     * @throws Exception if the demonstration fails
     */
    void demonstrate() throws Exception;
}
