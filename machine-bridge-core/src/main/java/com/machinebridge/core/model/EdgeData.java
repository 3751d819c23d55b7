package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Configuration data of a transition.
 *
 * @param eventTypeData trigger of the transition
 * @param actions action block ids
 * @param guard guard block id, or null
 * @param description description, or null
 * @param internal false when the transition re-enters its source
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EdgeData(
    EventTypeData eventTypeData,
    List<String> actions,
    String guard,
    String description,
    boolean internal
) {
    /**
     * Compact constructor with validation.
     */
    public EdgeData {
        Objects.requireNonNull(eventTypeData, "eventTypeData must not be null");
        actions = actions != null ? List.copyOf(actions) : List.of();
    }
}
