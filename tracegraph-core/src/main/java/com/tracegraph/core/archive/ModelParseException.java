package com.tracegraph.core.archive;

import java.io.IOException;

/**
 * Raised when a payload is not well-formed markup.
 *
 * @since 1.0.0
 */
public class ModelParseException extends IOException {

    private final String payload;

    public ModelParseException(String payload, String message, Throwable cause) {
        super(payload + ": " + message, cause);
        this.payload = payload;
    }

    /**
     * Name of the payload that failed to parse (archive entry or file name).
     *
     * @return payload name
     */
    public String getPayload() {
        return payload;
    }
}
