package com.machinebridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One {@code meta} entry of a state.
 *
 * @param key meta key
 * @param value literal value as JSON
 */
public record MetaEntry(String key, JsonNode value) {

    public MetaEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
