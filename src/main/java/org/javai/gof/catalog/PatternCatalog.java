package org.javai.gof.catalog;

import org.javai.gof.Category;
import org.javai.gof.DemoContext;
import org.javai.gof.Outcome;
import org.javai.gof.PatternDemo;
import org.javai.gof.boundary.DemoBoundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The discovered pattern demos, one instance per registered variant, sorted by display name.
 *
 * <p>A catalog is built once by {@link #discover} and never changes afterwards. Names are
 * compared ordinally ({@link String#compareTo}), so ordering is case-sensitive and does not
 * depend on the default locale.
 */
public final class PatternCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(PatternCatalog.class);

    static final Comparator<CatalogEntry> BY_NAME = Comparator.comparing(CatalogEntry::name);

    private final List<CatalogEntry> entries;

    private PatternCatalog(List<CatalogEntry> entries) {
        List<CatalogEntry> sorted = new ArrayList<>(entries);
        sorted.sort(BY_NAME);
        this.entries = Collections.unmodifiableList(sorted);
    }

    /**
     * Constructs every registered demo through the boundary.
     *
     * <p>A variant whose factory throws is reported by the boundary and left out; discovery
     * carries on with the remaining variants. An empty registry gives an empty catalog.
     *
     * @param registry what to construct
     * @param context handed to every factory
     * @param boundary catches and reports construction failures
     */
    public static PatternCatalog discover(DemoRegistry registry, DemoContext context, DemoBoundary boundary) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(boundary, "boundary must not be null");

        List<CatalogEntry> discovered = new ArrayList<>();
        for (DemoRegistration registration : registry.registrations()) {
            Outcome<PatternDemo> demo = boundary.construct(
                    registration.variant(),
                    () -> registration.factory().create(context));
            if (demo.isOk()) {
                discovered.add(new CatalogEntry(demo.getOrThrow(), registration.category()));
            }
        }

        int skipped = registry.size() - discovered.size();
        if (skipped > 0) {
            LOG.warn("Discovered {} pattern demos, skipped {} that could not be created", discovered.size(), skipped);
        } else {
            LOG.info("Discovered {} pattern demos", discovered.size());
        }
        return new PatternCatalog(discovered);
    }

    /**
     * Every entry, sorted by display name.
     */
    public List<CatalogEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Entries whose category label equals {@code label} exactly (case-sensitive), in display
     * name order. Empty when nothing matches.
     */
    public List<CatalogEntry> filterByCategory(String label) {
        List<CatalogEntry> matches = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            if (entry.category().label().equals(label)) {
                matches.add(entry);
            }
        }
        return Collections.unmodifiableList(matches);
    }

    public List<CatalogEntry> filterByCategory(Category category) {
        Objects.requireNonNull(category, "category must not be null");
        return filterByCategory(category.label());
    }

    /**
     * Groups entries by category label. Keys iterate in ascending order and only categories
     * that have entries appear; each group is sorted by display name.
     */
    public SortedMap<String, List<CatalogEntry>> groupByCategory() {
        SortedMap<String, List<CatalogEntry>> groups = new TreeMap<>();
        for (CatalogEntry entry : entries) {
            groups.computeIfAbsent(entry.category().label(), label -> new ArrayList<>()).add(entry);
        }
        groups.replaceAll((label, group) -> Collections.unmodifiableList(group));
        return Collections.unmodifiableSortedMap(groups);
    }
}
