package com.tracegraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * All references to one block path within one generated source file.
 *
 * @param filePath source file path relative to the extraction directory
 * @param blockPath block path, e.g. {@code <S1>/K}
 * @param references referencing lines in file order
 */
public record CodeMapping(
    String filePath,
    String blockPath,
    List<CodeReference> references
) {
    /**
     * Compact constructor with validation.
     */
    public CodeMapping {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(blockPath, "blockPath must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    /**
     * Last segment of the block path.
     *
     * @return block name
     */
    public String blockName() {
        int slash = blockPath.lastIndexOf('/');
        return slash >= 0 ? blockPath.substring(slash + 1) : blockPath;
    }

    /**
     * Location key combining file and block path.
     *
     * @return "file:blockPath"
     */
    public String location() {
        return filePath + ":" + blockPath;
    }
}
