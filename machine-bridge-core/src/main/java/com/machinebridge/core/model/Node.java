package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A state of the machine.
 *
 * @param id node id
 * @param parentId parent node id, null only for the root
 * @param data state configuration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Node(String id, String parentId, NodeData data) {

    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }
}
