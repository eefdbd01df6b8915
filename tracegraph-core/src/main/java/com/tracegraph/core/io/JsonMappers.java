package com.tracegraph.core.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mappers.
 *
 * <p>{@link #documents()} writes indented output for the emitted documents;
 * {@link #canonical()} writes compact output with map entries sorted by key, which makes the
 * serialization of a node body a stable function of its content.
 */
public final class JsonMappers {

    private static final ObjectMapper DOCUMENTS = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.INDENT_OUTPUT);

    private JsonMappers() {
    }

    /**
     * Mapper for emitted documents and stores.
     *
     * @return indented mapper
     */
    public static ObjectMapper documents() {
        return DOCUMENTS;
    }

    /**
     * Mapper for hashed snapshots.
     *
     * @return compact, key-sorted mapper
     */
    public static ObjectMapper canonical() {
        return CANONICAL;
    }
}
