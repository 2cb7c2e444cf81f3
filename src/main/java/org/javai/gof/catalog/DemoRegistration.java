package org.javai.gof.catalog;

import org.javai.gof.Category;

import java.util.Objects;

/**
 * One entry of a {@link DemoRegistry}: how to build a demo and which category it belongs to.
 *
 * @param variant Identifying name of the demo variant, used in warnings
 * @param category Category tag; null is normalized to {@link Category#UNKNOWN}
 * @param factory Creates the demo
 */
public record DemoRegistration(String variant, Category category, DemoFactory factory) {

    public DemoRegistration {
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (variant.isBlank()) {
            throw new IllegalArgumentException("variant must not be blank");
        }
        category = category == null ? Category.UNKNOWN : category;
    }
}
