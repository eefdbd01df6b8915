package com.tracegraph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A model element seen during one parse. Never persisted.
 *
 * @param id internal element id ({@code xmi:id})
 * @param declaredType declared type ({@code xmi:type}), empty when absent
 * @param tag qualified element tag
 * @param attributes element attributes by qualified name
 * @param source originating source attribute, or null
 * @param commentBody first nested comment body in document order, or null
 */
public record RawElement(
    String id,
    String declaredType,
    String tag,
    Map<String, String> attributes,
    String source,
    String commentBody
) {
    /**
     * Compact constructor with validation.
     */
    public RawElement {
        Objects.requireNonNull(id, "id must not be null");
        if (declaredType == null) {
            declaredType = "";
        }
        if (tag == null) {
            tag = "";
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Element name, empty when the element has no name attribute.
     *
     * @return name
     */
    public String name() {
        return attributes.getOrDefault("name", "");
    }

    /**
     * Returns an attribute value.
     *
     * @param key qualified attribute name
     * @return value or null
     */
    public String attribute(String key) {
        return attributes.get(key);
    }
}
