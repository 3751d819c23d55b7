package com.machinebridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Machine-level data.
 *
 * @param context literal context as JSON, or a text marker {@code {{<function source>}}} for a
 *                context factory function
 */
public record DigraphData(JsonNode context) {

    public DigraphData {
        context = context != null ? context : JsonNodeFactory.instance.objectNode();
    }
}
