package org.javai.gof.menu;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * A {@link Terminal} over an input stream and a print stream.
 *
 * <p>Standard input is line-buffered, so "press a key" means pressing Enter: {@link #awaitKey()}
 * consumes one line. Clearing uses ANSI escape sequences and can be switched off for
 * terminals (and tests) that do not understand them.
 */
public class StreamTerminal implements Terminal {

    private static final String ANSI_CLEAR = "\033[H\033[2J";

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean clearScreen;

    public StreamTerminal(InputStream in, PrintStream out, boolean clearScreen) {
        this(new BufferedReader(new InputStreamReader(in, Charset.defaultCharset())), out, clearScreen);
    }

    public StreamTerminal(BufferedReader in, PrintStream out, boolean clearScreen) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.clearScreen = clearScreen;
    }

    /**
     * The process console: {@code System.in} and {@code System.out}.
     */
    public static StreamTerminal system(boolean clearScreen) {
        return new StreamTerminal(System.in, System.out, clearScreen);
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }

    @Override
    public void println(String line) {
        out.println(line);
    }

    @Override
    public String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read from the console", e);
        }
    }

    @Override
    public void awaitKey() {
        readLine();
    }

    @Override
    public void clear() {
        if (clearScreen) {
            out.print(ANSI_CLEAR);
            out.flush();
        }
    }
}
