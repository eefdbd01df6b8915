package com.tracegraph.core.model;

/**
 * Traceability relationship kinds between requirements.
 */
public enum RelationshipKind {
    /** Derived from the supplier (incoming edge on the canonical node) */
    DERIVES("derive"),

    /** Refines the supplier */
    REFINES("refine"),

    /** Satisfies the supplier */
    SATISFIES("satisfy"),

    /** Verifies the supplier */
    VERIFIES("verify"),

    /** Generic trace, the fallback kind */
    TRACES("trace");

    private final String keyword;

    RelationshipKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Lower-case keyword used to classify stereotypes and relationship names.
     *
     * @return keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Classifies a free-form label (stereotype or element name) by keyword containment.
     *
     * <p>Only derive, refine, satisfy and verify are recognised; anything else yields null
     * so that callers can continue with the next fallback.
     *
     * @param label label to classify
     * @return matching kind, or null
     */
    public static RelationshipKind fromLabel(String label) {
        if (label == null || label.isEmpty()) {
            return null;
        }
        String lower = label.toLowerCase();
        for (RelationshipKind kind : values()) {
            if (kind != TRACES && lower.contains(kind.keyword)) {
                return kind;
            }
        }
        return null;
    }
}
