package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result of processing one input in a batch.
 *
 * @param filename input file or directory name
 * @param scanner id of the scanner that handled the input
 * @param status "success" or "failed"
 * @param entities number of nodes or mappings extracted
 * @param outputFile output document path relative to the output directory, null when failed
 * @param error failure reason, null when successful
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileOutcome(
    @JsonProperty("filename") String filename,
    @JsonProperty("scanner") String scanner,
    @JsonProperty("status") String status,
    @JsonProperty("entities") int entities,
    @JsonProperty("output_file") String outputFile,
    @JsonProperty("error") String error
) {
    /** Status of a successfully processed input. */
    public static final String SUCCESS = "success";

    /** Status of a failed input. */
    public static final String FAILED = "failed";

    /**
     * Compact constructor with validation.
     */
    public FileOutcome {
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Returns true if the input was processed successfully.
     *
     * @return true on success
     */
    public boolean succeeded() {
        return SUCCESS.equals(status);
    }
}
