package org.javai.gof;

import java.util.Objects;

/**
 * What went wrong, independent of where and when: the classified form of a thrown exception.
 *
 * @param family The failure family (e.g., "demo", "io", "unknown")
 * @param name The specific failure within the family (e.g., "null_pointer")
 * @param message Human-readable message, shown to the user as-is
 * @param cause The underlying exception details (may be null)
 */
public record FailureKind(String family, String name, String message, Cause cause) {

    public FailureKind {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (family.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("family and name must not be blank");
        }
    }

    /**
     * The stable {@code family:name} code used in logs.
     */
    public String code() {
        return family + ":" + name;
    }
}
