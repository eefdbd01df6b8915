package com.tracegraph.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated documents to be rendered.
 *
 * @param files list of generated documents
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns true if there is nothing to render.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return files.isEmpty();
    }
}
