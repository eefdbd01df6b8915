package com.tracegraph.core.versioning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tracegraph.core.io.GraphDocumentCodec;
import com.tracegraph.core.io.JsonMappers;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.util.Hashing;

import java.io.UncheckedIOException;

/**
 * Canonical serialization and hashing of node bodies.
 *
 * <p>The snapshot of a node is its document body (everything but the id) written as compact JSON
 * with object keys sorted at every level; list order is kept. The version id is the SHA-256 hex
 * digest of that text, so equal content always yields an equal id.
 */
public final class Snapshots {

    private Snapshots() {
    }

    /**
     * Canonical serialization of a node body.
     *
     * @param node node
     * @return sorted-key compact JSON
     */
    public static String snapshotOf(CanonicalNode node) {
        try {
            return JsonMappers.canonical().writeValueAsString(GraphDocumentCodec.nodeBody(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize node " + node.id(), e);
        }
    }

    /**
     * Content hash of a snapshot.
     *
     * @param snapshot canonical serialization
     * @return SHA-256 hex digest
     */
    public static String versionIdOf(String snapshot) {
        return Hashing.sha256Hex(snapshot);
    }
}
