package com.tracegraph.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A SysML requirement extracted from a requirements-model archive.
 *
 * <p>The five relationship lists hold internal ids ({@code xmiId}) of other requirements
 * of the same parse. They are only meaningful after relationship resolution.
 *
 * @param reqId business-facing requirement id (e.g. "TWCAT150.3.1")
 * @param xmiId internal model id, unique within one parse
 * @param name requirement name
 * @param text requirement text
 * @param reqType requirement type (Functional, Performance, ..., General)
 * @param properties remaining element attributes
 * @param derivesFrom requirements this one derives from
 * @param refines requirements this one refines
 * @param satisfies requirements this one satisfies
 * @param verifies requirements this one verifies
 * @param tracesTo requirements this one traces to
 * @param sourceFile originating source of the element
 */
public record Requirement(
    String reqId,
    String xmiId,
    String name,
    String text,
    String reqType,
    Map<String, String> properties,
    List<String> derivesFrom,
    List<String> refines,
    List<String> satisfies,
    List<String> verifies,
    List<String> tracesTo,
    String sourceFile
) {
    /** Text placeholder for requirements that carry no text. */
    public static final String NO_TEXT = "No text specified";

    /**
     * Compact constructor with validation.
     */
    public Requirement {
        Objects.requireNonNull(reqId, "reqId must not be null");
        Objects.requireNonNull(xmiId, "xmiId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        derivesFrom = derivesFrom == null ? List.of() : List.copyOf(derivesFrom);
        refines = refines == null ? List.of() : List.copyOf(refines);
        satisfies = satisfies == null ? List.of() : List.copyOf(satisfies);
        verifies = verifies == null ? List.of() : List.copyOf(verifies);
        tracesTo = tracesTo == null ? List.of() : List.copyOf(tracesTo);
    }

    /**
     * Returns a copy of this requirement with all relationship lists replaced.
     *
     * @param resolved relationship lists keyed by kind; missing kinds become empty
     * @return new requirement
     */
    public Requirement withRelationships(Map<RelationshipKind, List<String>> resolved) {
        return new Requirement(
            reqId,
            xmiId,
            name,
            text,
            reqType,
            properties,
            resolved.get(RelationshipKind.DERIVES),
            resolved.get(RelationshipKind.REFINES),
            resolved.get(RelationshipKind.SATISFIES),
            resolved.get(RelationshipKind.VERIFIES),
            resolved.get(RelationshipKind.TRACES),
            sourceFile
        );
    }
}
