package com.tracegraph.core.renderer;

import java.util.Objects;

/**
 * Represents a generated document to be rendered.
 *
 * @param relativePath relative path for the document (e.g., "requirements/spec_connectivity.json")
 * @param content document content
 * @param contentType content type
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /** Content type of every document the pipeline emits. */
    public static final String JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates a JSON document.
     *
     * @param relativePath relative path
     * @param content JSON text
     * @return generated file
     */
    public static GeneratedFile json(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, JSON);
    }
}
