package com.tracegraph.core.versioning;

import com.tracegraph.core.io.JsonMappers;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.ConnectionSnapshot;
import com.tracegraph.core.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fingerprints the connection set of a block model.
 *
 * <p>Pairs are read from the outgoing lists of the graph, formatted as
 * {@code source->destination} and sorted; the version id is the SHA-256 digest of the sorted
 * pairs joined by newlines. Snapshots are kept per model under
 * {@code <store directory>/simulink/<model>_connections.json}.
 *
 * @since 1.0.0
 */
public class ConnectionFingerprint {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFingerprint.class);

    static final String SEPARATOR = "->";

    private final Clock clock;

    public ConnectionFingerprint(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Sorted {@code source->destination} pairs of a graph.
     *
     * @param graph block graph
     * @return sorted pairs, duplicates kept
     */
    public static List<String> connectionPairs(CanonicalGraph graph) {
        List<String> pairs = new ArrayList<>();
        for (CanonicalNode node : graph.nodes().values()) {
            for (String target : node.outgoing()) {
                pairs.add(node.id() + SEPARATOR + target);
            }
        }
        Collections.sort(pairs);
        return pairs;
    }

    /**
     * Computes a snapshot without consulting any prior state.
     *
     * @param modelName model name
     * @param graph block graph
     * @return snapshot stamped with the current time
     */
    public ConnectionSnapshot fingerprint(String modelName, CanonicalGraph graph) {
        List<String> pairs = connectionPairs(graph);
        String versionId = Hashing.sha256Hex(String.join("\n", pairs));
        return new ConnectionSnapshot(modelName, versionId, pairs.size(), Instant.now(clock).toString(), pairs);
    }

    /**
     * Store location of a model's snapshot.
     *
     * @param storeDirectory version store directory
     * @param modelName model name
     * @return snapshot file
     */
    public static Path snapshotFile(Path storeDirectory, String modelName) {
        return storeDirectory.resolve("simulink").resolve(modelName + "_connections.json");
    }

    /**
     * Computes the snapshot of a model and persists it when the connection set changed.
     * An unchanged hash returns the prior snapshot as stored.
     *
     * @param storeDirectory version store directory
     * @param modelName model name
     * @param graph block graph
     * @return current snapshot
     * @throws IOException if a changed snapshot cannot be written
     */
    public ConnectionSnapshot update(Path storeDirectory, String modelName, CanonicalGraph graph) throws IOException {
        ConnectionSnapshot computed = fingerprint(modelName, graph);
        Path file = snapshotFile(storeDirectory, modelName);
        ConnectionSnapshot prior = readPrior(file);

        if (prior != null && prior.versionId().equals(computed.versionId())) {
            log.debug("Connections of {} unchanged ({})", modelName, computed.versionId());
            return prior;
        }

        Files.createDirectories(file.getParent());
        JsonMappers.documents().writeValue(file.toFile(), computed);
        log.info("Connections of {} {}: {} connections, version {}", modelName,
            prior == null ? "recorded" : "changed", computed.connectionCount(), computed.versionId());
        return computed;
    }

    private ConnectionSnapshot readPrior(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return JsonMappers.documents().readValue(file.toFile(), ConnectionSnapshot.class);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Connection snapshot {} is unreadable, recording a new one: {}", file, e.getMessage());
            return null;
        }
    }
}
