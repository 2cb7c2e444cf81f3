package org.javai.gof;

import org.javai.gof.boundary.DemoBoundary;
import org.javai.gof.menu.MenuController;
import org.javai.gof.menu.StreamTerminal;
import org.javai.gof.ops.CompositeFailureReporter;
import org.javai.gof.ops.ConsoleWarningReporter;
import org.javai.gof.ops.FailureReporter;
import org.javai.gof.ops.log4j.Log4jFailureReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console entry point: builds the catalog and runs the interactive menu.
 *
 * <p>Failures of individual demos are handled inside the menu. Anything that still escapes
 * (a broken console, invalid configuration) is logged and reported here, and the program
 * exits normally.
 */
public final class PatternsApp {

    private static final Logger LOG = LoggerFactory.getLogger(PatternsApp.class);

    private PatternsApp() {}

    public static void main(String[] args) {
        StreamTerminal terminal = StreamTerminal.system(false);
        try {
            DemoSettings settings = DemoSettings.fromEnvironment();
            terminal = StreamTerminal.system(settings.clearScreen());

            FailureReporter reporter = CompositeFailureReporter.builder()
                    .add(new ConsoleWarningReporter(System.out))
                    .add(new Log4jFailureReporter())
                    .build();

            MenuController menu = MenuController.standard(
                    terminal,
                    DemoContext.of(System.out, settings),
                    DemoBoundary.withReporter(reporter));
            menu.run();
        } catch (Exception e) {
            LOG.error("Application error", e);
            terminal.println("Application error: " + e.getMessage());
            terminal.println("Press Enter to exit...");
            terminal.awaitKey();
        }
    }
}
