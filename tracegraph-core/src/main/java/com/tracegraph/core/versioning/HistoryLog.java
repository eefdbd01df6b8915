package com.tracegraph.core.versioning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracegraph.core.model.ArtifactVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only JSON-lines log of every version record ever emitted for a store.
 *
 * <p>The log lives next to its store as {@code <store file>.history.jsonl}. Records are never
 * rewritten, so the log holds the full lineage of each artifact while the store only holds the
 * current version.
 *
 * @since 1.0.0
 */
public class HistoryLog {

    private static final Logger log = LoggerFactory.getLogger(HistoryLog.class);
    private static final ObjectMapper LINE_MAPPER = new ObjectMapper();

    /** Suffix appended to the store file name. */
    public static final String SUFFIX = ".history.jsonl";

    private final Path file;

    public HistoryLog(Path file) {
        this.file = file;
    }

    /**
     * Returns the log belonging to a store file.
     *
     * @param storeFile store file
     * @return history log
     */
    public static HistoryLog forStore(Path storeFile) {
        return new HistoryLog(storeFile.resolveSibling(storeFile.getFileName() + SUFFIX));
    }

    public Path file() {
        return file;
    }

    /**
     * Appends records.
     *
     * @param records records to append
     * @throws IOException if the log cannot be written
     */
    public void append(List<ArtifactVersion> records) throws IOException {
        if (records.isEmpty()) {
            return;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (ArtifactVersion record : records) {
                writer.write(LINE_MAPPER.writeValueAsString(record));
                writer.newLine();
            }
        }
        log.debug("Appended {} records to {}", records.size(), file);
    }

    /**
     * Reads all records in append order. Unparseable lines are skipped with a warning.
     *
     * @return records, empty when the log does not exist
     * @throws IOException if the log cannot be read
     */
    public List<ArtifactVersion> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<ArtifactVersion> records = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(LINE_MAPPER.readValue(line, ArtifactVersion.class));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable history line {} of {}: {}", lineNumber, file, e.getMessage());
            }
        }
        return records;
    }

    /**
     * Returns the lineage of one artifact, newest first, by following parent pointers from the
     * given head version.
     *
     * @param artifactId artifact id
     * @param headVersionId version to start from, or null for the most recently appended record
     * @return records from head to the initial version
     * @throws IOException if the log cannot be read
     */
    public List<ArtifactVersion> lineage(String artifactId, String headVersionId) throws IOException {
        List<ArtifactVersion> records = new ArrayList<>();
        for (ArtifactVersion record : readAll()) {
            if (artifactId.equals(record.artifactId())) {
                records.add(record);
            }
        }
        if (records.isEmpty()) {
            return List.of();
        }

        // the latest record for a version id reflects the most recent parent
        Map<String, ArtifactVersion> byVersion = new HashMap<>();
        for (ArtifactVersion record : records) {
            byVersion.put(record.versionId(), record);
        }

        ArtifactVersion current = headVersionId != null
            ? byVersion.get(headVersionId)
            : records.get(records.size() - 1);
        List<ArtifactVersion> lineage = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (current != null && seen.add(current.versionId())) {
            lineage.add(current);
            current = current.parentVersionId() == null ? null : byVersion.get(current.parentVersionId());
        }
        return Collections.unmodifiableList(lineage);
    }
}
