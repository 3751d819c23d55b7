package com.machinebridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A transition between states.
 *
 * @param id edge id
 * @param source source node id
 * @param targets resolved target node ids, empty for a targetless transition
 * @param data transition configuration
 */
public record Edge(String id, String source, List<String> targets, EdgeData data) {

    /**
     * Compact constructor with validation.
     */
    public Edge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(data, "data must not be null");
        targets = targets != null ? List.copyOf(targets) : List.of();
    }
}
