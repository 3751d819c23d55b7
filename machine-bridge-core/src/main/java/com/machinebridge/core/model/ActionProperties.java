package com.machinebridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Properties of an {@link ActionBlock}.
 *
 * @param type action type, equal to the block's source id
 * @param params literal {@code params} of an action object, empty object otherwise
 */
public record ActionProperties(String type, JsonNode params) {

    public ActionProperties {
        Objects.requireNonNull(type, "type must not be null");
        params = params != null ? params : JsonNodeFactory.instance.objectNode();
    }
}
