package com.tracegraph.core.model;

import java.util.Objects;

/**
 * Parsed end of a signal line.
 *
 * @param sid block id
 * @param kind port kind
 * @param port port number (0 for state ports)
 */
public record SignalEndpoint(String sid, PortKind kind, int port) {

    /**
     * Compact constructor with validation.
     */
    public SignalEndpoint {
        Objects.requireNonNull(sid, "sid must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
