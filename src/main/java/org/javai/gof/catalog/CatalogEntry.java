package org.javai.gof.catalog;

import org.javai.gof.Category;
import org.javai.gof.PatternDemo;

import java.util.Objects;

/**
 * A constructed demo together with the category it was registered under.
 */
public record CatalogEntry(PatternDemo demo, Category category) {

    public CatalogEntry {
        Objects.requireNonNull(demo, "demo must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    public String name() {
        return demo.name();
    }

    public String description() {
        return demo.description();
    }
}
