package com.tracegraph.core.model;

import java.util.Objects;

/**
 * A stereotype applied to a base model element.
 *
 * @param stereotype recognised stereotype keyword (Requirement, Derive, Refine, Satisfy, Verify, Trace)
 * @param stereotypeId business id carried on the application, or null
 * @param stereotypeText text carried on the application, or null
 * @param source source attribute carried on the application, or null
 */
public record StereotypeApplication(
    String stereotype,
    String stereotypeId,
    String stereotypeText,
    String source
) {
    /** Stereotype keyword marking requirements. */
    public static final String REQUIREMENT = "Requirement";

    /**
     * Compact constructor with validation.
     */
    public StereotypeApplication {
        Objects.requireNonNull(stereotype, "stereotype must not be null");
    }

    /**
     * Returns true if this application marks a requirement.
     *
     * @return true for the Requirement stereotype
     */
    public boolean isRequirement() {
        return REQUIREMENT.equals(stereotype);
    }
}
