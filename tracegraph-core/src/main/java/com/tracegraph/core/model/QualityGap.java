package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Represents a gap detected while extracting or validating a batch.
 *
 * <p>Quality gaps never block export; they are reported in the batch summary.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * QualityGap gap = QualityGap.warning(
 *     "system_reqs.mdzip",
 *     "3 requirements without text"
 * );
 * }</pre>
 *
 * @param source input or graph the gap was found in
 * @param message human-readable description
 * @param severity severity level
 */
public record QualityGap(
    @JsonProperty("source") String source,
    @JsonProperty("message") String message,
    @JsonProperty("severity") GapSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public QualityGap {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    /**
     * Create an informational gap.
     *
     * @param source the source
     * @param message the message
     * @return a new QualityGap with INFO severity
     */
    public static QualityGap info(String source, String message) {
        return new QualityGap(source, message, GapSeverity.INFO);
    }

    /**
     * Create a warning gap.
     *
     * @param source the source
     * @param message the message
     * @return a new QualityGap with WARNING severity
     */
    public static QualityGap warning(String source, String message) {
        return new QualityGap(source, message, GapSeverity.WARNING);
    }

    /**
     * Create an error gap.
     *
     * @param source the source
     * @param message the message
     * @return a new QualityGap with ERROR severity
     */
    public static QualityGap error(String source, String message) {
        return new QualityGap(source, message, GapSeverity.ERROR);
    }
}
