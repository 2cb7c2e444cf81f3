package org.javai.gof.menu;

import org.javai.gof.Category;
import org.javai.gof.DemoContext;
import org.javai.gof.Outcome;
import org.javai.gof.boundary.DemoBoundary;
import org.javai.gof.catalog.CatalogEntry;
import org.javai.gof.catalog.DemoRegistry;
import org.javai.gof.catalog.PatternCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives the interactive session: reads the user's choices, queries the catalog, and runs
 * demos through the boundary.
 *
 * <p>The session is a small state machine over {@link MenuState}. Each call to
 * {@link #step(MenuState)} renders one state, reads what that state needs from the terminal,
 * and returns the next state. Nothing a demo does can end the session: failures are shown
 * inline and control always comes back to the main menu, until the user quits or input runs
 * out.
 */
public final class MenuController {

    private static final Logger LOG = LoggerFactory.getLogger(MenuController.class);

    static final String BANNER = "Design Patterns Demo - 23 GoF Patterns";
    static final String INVALID_OPTION = "Invalid option. Try again.";
    static final String INVALID_SELECTION = "Invalid selection.";
    static final String EXITING = "Exiting...";
    static final String CONTINUE_PROMPT = "\nPress Enter to continue...";

    private final PatternCatalog catalog;
    private final Terminal terminal;
    private final DemoBoundary boundary;

    public MenuController(PatternCatalog catalog, Terminal terminal, DemoBoundary boundary) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.terminal = Objects.requireNonNull(terminal, "terminal must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    /**
     * Builds the catalog from the standard registry and a controller over it.
     */
    public static MenuController standard(Terminal terminal, DemoContext context, DemoBoundary boundary) {
        PatternCatalog catalog = PatternCatalog.discover(DemoRegistry.standard(), context, boundary);
        return new MenuController(catalog, terminal, boundary);
    }

    public PatternCatalog catalog() {
        return catalog;
    }

    /**
     * Prints the banner and runs the session until it terminates.
     */
    public void run() {
        terminal.clear();
        terminal.println(BANNER);
        terminal.println("=".repeat(BANNER.length()));

        MenuState state = MenuState.MAIN_MENU;
        while (!state.isTerminal()) {
            state = step(state);
        }
        LOG.debug("Menu session terminated");
    }

    /**
     * Performs one state's interaction and returns the state to move to.
     */
    public MenuState step(MenuState state) {
        Objects.requireNonNull(state, "state must not be null");

        if (state instanceof MenuState.MainMenu) {
            return mainMenu();
        } else if (state instanceof MenuState.CategoryList list) {
            return categoryList(list.category());
        } else if (state instanceof MenuState.PatternDetail detail) {
            return patternDetail(detail.entry());
        } else if (state instanceof MenuState.AllPatternsList) {
            return allPatterns();
        }
        return MenuState.TERMINATED;
    }

    private MenuState mainMenu() {
        displayMainMenu();

        String line = terminal.readLine();
        if (line == null) {
            LOG.debug("Input exhausted at main menu");
            return MenuState.TERMINATED;
        }

        String choice = line.trim();
        if (choice.isEmpty()) {
            return MenuState.MAIN_MENU;
        }
        if (choice.equalsIgnoreCase("q")) {
            terminal.println(EXITING);
            return MenuState.TERMINATED;
        }
        return handleMenuChoice(choice);
    }

    private void displayMainMenu() {
        terminal.println("\nMain Menu:");
        terminal.println("1. Creational Patterns");
        terminal.println("2. Structural Patterns");
        terminal.println("3. Behavioral Patterns");
        terminal.println("4. Show All Patterns");
        terminal.println("Q. Quit");
        terminal.print("Select: ");
    }

    private MenuState handleMenuChoice(String choice) {
        switch (choice) {
            case "1":
                return new MenuState.CategoryList(Category.CREATIONAL);
            case "2":
                return new MenuState.CategoryList(Category.STRUCTURAL);
            case "3":
                return new MenuState.CategoryList(Category.BEHAVIORAL);
            case "4":
                return MenuState.ALL_PATTERNS;
            default:
                terminal.println(INVALID_OPTION);
                return MenuState.MAIN_MENU;
        }
    }

    private MenuState categoryList(Category category) {
        List<CatalogEntry> entries = catalog.filterByCategory(category);
        if (entries.isEmpty()) {
            terminal.println("No patterns found for category: " + category.label());
            return MenuState.MAIN_MENU;
        }

        terminal.clear();
        terminal.println(category.label() + " Patterns:");
        for (int i = 0; i < entries.size(); i++) {
            terminal.println((i + 1) + ". " + entries.get(i).name());
        }
        terminal.println("0. Back to Main Menu");
        terminal.print("Select a pattern: ");

        String line = terminal.readLine();
        if (line == null) {
            return MenuState.TERMINATED;
        }

        String choice = line.trim();
        if (choice.equals("0")) {
            return MenuState.MAIN_MENU;
        }

        Integer index = parseSelection(choice, entries.size());
        if (index != null) {
            return new MenuState.PatternDetail(entries.get(index - 1));
        }

        terminal.println(INVALID_SELECTION);
        pause();
        return MenuState.MAIN_MENU;
    }

    private static Integer parseSelection(String choice, int count) {
        int index;
        try {
            index = Integer.parseInt(choice);
        } catch (NumberFormatException e) {
            return null;
        }
        return index >= 1 && index <= count ? index : null;
    }

    private MenuState patternDetail(CatalogEntry entry) {
        String name = entry.name();
        terminal.clear();
        terminal.println(name + " Pattern");
        terminal.println("-".repeat(name.length() + 8));
        terminal.println("Description: " + entry.description() + "\n");

        LOG.debug("Running demo [{}]", name);
        Outcome<Void> outcome = boundary.demonstrate(entry.demo());
        outcome.onFailure(failure ->
                terminal.println("Error during demonstration: " + failure.message()));

        pause();
        return MenuState.MAIN_MENU;
    }

    private MenuState allPatterns() {
        terminal.clear();
        terminal.println("All Available Patterns:");

        for (Map.Entry<String, List<CatalogEntry>> group : catalog.groupByCategory().entrySet()) {
            terminal.println("\n" + group.getKey() + ":");
            for (CatalogEntry entry : group.getValue()) {
                terminal.println("  - " + entry.name());
            }
        }

        pause();
        return MenuState.MAIN_MENU;
    }

    private void pause() {
        terminal.println(CONTINUE_PROMPT);
        terminal.awaitKey();
    }
}
