package com.machinebridge.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mapper for digraphs, patches and text edits.
 *
 * <p>Empty variant records such as {@code EventTypeData.Always} carry only their type
 * discriminator, so empty beans must serialize. Unknown properties are ignored because patches
 * come from external editors that may attach fields of their own.
 */
public final class JsonMappers {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonMappers() {
        // Utility class - no instantiation
    }

    /**
     * Returns the shared mapper. The instance is thread-safe once configured and must not be
     * reconfigured by callers.
     *
     * @return shared object mapper
     */
    public static ObjectMapper standard() {
        return MAPPER;
    }
}
