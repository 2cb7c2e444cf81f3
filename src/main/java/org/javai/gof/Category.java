package org.javai.gof;

/**
 * The Gang of Four classification of a pattern, plus a catch-all for demos registered
 * without one.
 */
public enum Category {
    CREATIONAL("Creational"),
    STRUCTURAL("Structural"),
    BEHAVIORAL("Behavioral"),
    UNKNOWN("Unknown");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    /**
     * The label shown in menus and used as the grouping key, e.g. "Structural".
     */
    public String label() {
        return label;
    }
}
