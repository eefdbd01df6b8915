package com.tracegraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Code mappings recovered from one code-generation archive.
 *
 * @param sourceFile archive path
 * @param sourceFiles recovered source files, relative to the extraction directory
 * @param mappings mappings grouped by (file, block path)
 */
public record CodeMappingReport(
    String sourceFile,
    List<String> sourceFiles,
    List<CodeMapping> mappings
) {
    /**
     * Compact constructor with validation.
     */
    public CodeMappingReport {
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }
}
