package com.tracegraph.core.versioning;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tracegraph.core.io.JsonMappers;
import com.tracegraph.core.model.ArtifactVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current version record per artifact, persisted as one JSON object keyed by artifact id.
 *
 * <p>The store is read fully before tracking and rewritten fully afterwards. A store that cannot
 * be read loads as empty and {@linkplain #isDegraded() degraded}; tracking then treats every
 * artifact as new.
 *
 * <p>Only one writer per store file is supported.
 *
 * @since 1.0.0
 */
public final class VersionStore {

    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);
    private static final TypeReference<LinkedHashMap<String, ArtifactVersion>> STORE_TYPE = new TypeReference<>() {};

    private final Map<String, ArtifactVersion> versions;
    private final boolean degraded;

    private VersionStore(Map<String, ArtifactVersion> versions, boolean degraded) {
        this.versions = Collections.unmodifiableMap(new LinkedHashMap<>(versions));
        this.degraded = degraded;
    }

    /**
     * Creates an in-memory store.
     *
     * @param versions current versions keyed by artifact id
     * @return store
     */
    public static VersionStore of(Map<String, ArtifactVersion> versions) {
        return new VersionStore(versions, false);
    }

    /**
     * Creates an empty store.
     *
     * @return empty store
     */
    public static VersionStore empty() {
        return new VersionStore(Map.of(), false);
    }

    /**
     * Loads a store file. A missing file yields an empty store.
     *
     * @param file store file
     * @return loaded store, or an empty degraded store when the file cannot be read
     */
    public static VersionStore load(Path file) {
        if (!Files.exists(file)) {
            log.debug("No version store at {}, starting empty", file);
            return empty();
        }
        try {
            Map<String, ArtifactVersion> versions = JsonMappers.documents().readValue(file.toFile(), STORE_TYPE);
            if (versions == null) {
                versions = Map.of();
            }
            log.debug("Loaded {} versions from {}", versions.size(), file);
            return new VersionStore(versions, false);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Version store {} is unreadable, treating all artifacts as new: {}", file, e.getMessage());
            return new VersionStore(Map.of(), true);
        }
    }

    /**
     * Writes the store, replacing the previous file atomically where the file system allows.
     *
     * @param file store file
     * @throws IOException if the store cannot be written
     */
    public void save(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        JsonMappers.documents().writeValue(temp.toFile(), versions);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Saved {} versions to {}", versions.size(), file);
    }

    /**
     * Current version of an artifact.
     *
     * @param artifactId artifact id
     * @return version or null
     */
    public ArtifactVersion get(String artifactId) {
        return versions.get(artifactId);
    }

    public Map<String, ArtifactVersion> versions() {
        return versions;
    }

    public int size() {
        return versions.size();
    }

    /**
     * Returns true if the store file existed but could not be read.
     *
     * @return true when degraded
     */
    public boolean isDegraded() {
        return degraded;
    }
}
