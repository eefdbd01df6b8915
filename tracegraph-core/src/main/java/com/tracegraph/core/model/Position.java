package com.tracegraph.core.model;

/**
 * Rectangle of a block on its diagram.
 *
 * @param x left
 * @param y top
 * @param width width
 * @param height height
 */
public record Position(int x, int y, int width, int height) {

    /** Position used when a block has no parseable position. */
    public static final Position DEFAULT = new Position(0, 0, 100, 50);

    /**
     * Formats the position the way block-diagram descriptors write it.
     *
     * @return e.g. "[0, 0, 100, 50]"
     */
    public String format() {
        return "[" + x + ", " + y + ", " + width + ", " + height + "]";
    }
}
