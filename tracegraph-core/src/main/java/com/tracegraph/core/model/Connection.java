package com.tracegraph.core.model;

import java.util.Objects;

/**
 * A signal connection between two blocks.
 *
 * @param sourceBlock source block sid
 * @param sourcePort source port number
 * @param destBlock destination block sid
 * @param destPort destination port number
 * @param signalName signal name, or null
 */
public record Connection(
    String sourceBlock,
    int sourcePort,
    String destBlock,
    int destPort,
    String signalName
) {
    /**
     * Compact constructor with validation.
     */
    public Connection {
        Objects.requireNonNull(sourceBlock, "sourceBlock must not be null");
        Objects.requireNonNull(destBlock, "destBlock must not be null");
    }

    /**
     * Creates a connection between two parsed endpoints.
     *
     * @param source source endpoint
     * @param dest destination endpoint
     * @param signalName signal name, or null
     * @return connection
     */
    public static Connection between(SignalEndpoint source, SignalEndpoint dest, String signalName) {
        return new Connection(source.sid(), source.port(), dest.sid(), dest.port(), signalName);
    }
}
