package com.tracegraph.core.model;

/**
 * Kind of a signal endpoint.
 */
public enum PortKind {
    /** Numbered output port, {@code <sid>#out:<n>} */
    OUT,

    /** Numbered input port, {@code <sid>#in:<n>} */
    IN,

    /** State port, {@code <sid>#state}, normalised to port 0 */
    STATE
}
