package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.StereotypeApplication;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parse-scoped lookup tables built by {@link XmiElementCollector}.
 *
 * <p>Both maps keep document order. They are created per parse and never shared between inputs.
 *
 * @param stereotypes stereotype applications keyed by base element id
 * @param elements identified elements keyed by {@code xmi:id}
 * @param elementsVisited number of elements traversed
 */
public record XmiIndex(
    Map<String, StereotypeApplication> stereotypes,
    Map<String, RawElement> elements,
    int elementsVisited
) {
    public XmiIndex {
        stereotypes = Collections.unmodifiableMap(new LinkedHashMap<>(stereotypes));
        elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    /**
     * Returns the stereotype applied to an element.
     *
     * @param elementId element id
     * @return application or null
     */
    public StereotypeApplication stereotypeOf(String elementId) {
        return stereotypes.get(elementId);
    }

    /**
     * Returns an element by id.
     *
     * @param elementId element id
     * @return element or null
     */
    public RawElement element(String elementId) {
        return elements.get(elementId);
    }
}
