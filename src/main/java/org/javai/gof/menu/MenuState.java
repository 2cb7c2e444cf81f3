package org.javai.gof.menu;

import org.javai.gof.Category;
import org.javai.gof.catalog.CatalogEntry;

import java.util.Objects;

/**
 * Where the user is in the menu. {@link MainMenu} is the initial state and {@link Terminated}
 * the only final one.
 */
public sealed interface MenuState permits
        MenuState.MainMenu,
        MenuState.CategoryList,
        MenuState.PatternDetail,
        MenuState.AllPatternsList,
        MenuState.Terminated {

    MenuState MAIN_MENU = new MainMenu();
    MenuState ALL_PATTERNS = new AllPatternsList();
    MenuState TERMINATED = new Terminated();

    /**
     * Showing the top-level options.
     */
    record MainMenu() implements MenuState {}

    /**
     * Listing the demos of one category and asking which to run.
     */
    record CategoryList(Category category) implements MenuState {
        public CategoryList {
            Objects.requireNonNull(category, "category must not be null");
        }
    }

    /**
     * Running one demo.
     */
    record PatternDetail(CatalogEntry entry) implements MenuState {
        public PatternDetail {
            Objects.requireNonNull(entry, "entry must not be null");
        }
    }

    /**
     * Listing every demo grouped by category.
     */
    record AllPatternsList() implements MenuState {}

    /**
     * The session is over.
     */
    record Terminated() implements MenuState {}

    default boolean isTerminal() {
        return this instanceof Terminated;
    }
}
