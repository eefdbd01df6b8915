package com.tracegraph.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.UncheckedIOException;

/**
 * Serializes annotated records (batch summaries, validation reports, snapshots) as indented JSON.
 */
public final class JsonDocuments {

    private JsonDocuments() {
    }

    /**
     * Serializes a value.
     *
     * @param value record or map
     * @return indented JSON
     */
    public static String write(Object value) {
        try {
            return JsonMappers.documents().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
