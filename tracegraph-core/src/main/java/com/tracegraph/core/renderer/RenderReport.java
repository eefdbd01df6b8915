package com.tracegraph.core.renderer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one render call.
 *
 * @param written relative paths rendered successfully
 * @param failures failure message per relative path
 */
public record RenderReport(
    List<String> written,
    Map<String, String> failures
) {
    /**
     * Compact constructor with validation.
     */
    public RenderReport {
        written = written == null ? List.of() : List.copyOf(written);
        failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * Returns true if every document was rendered.
     *
     * @return true without failures
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }
}
