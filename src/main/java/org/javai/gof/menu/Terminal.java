package org.javai.gof.menu;

/**
 * The console as the menu sees it.
 */
public interface Terminal {

    void print(String text);

    void println(String line);

    default void println() {
        println("");
    }

    /**
     * Reads one line of input.
     *
     * @return the line without its terminator, or null once input is exhausted
     */
    String readLine();

    /**
     * Blocks until the user acknowledges; returns at once if input is exhausted.
     */
    void awaitKey();

    /**
     * Clears the screen, if the terminal supports and is configured to do so.
     */
    void clear();
}
