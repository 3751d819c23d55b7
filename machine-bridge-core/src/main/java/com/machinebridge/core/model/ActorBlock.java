package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Actor block, produced by {@code invoke}.
 *
 * @param id block id
 * @param parentId owning node id
 * @param sourceId actor source name or inline marker
 * @param properties actor properties
 */
@JsonTypeName("actor")
public record ActorBlock(String id, String parentId, String sourceId, ActorProperties properties) implements Block {

    /**
     * Compact constructor with validation.
     */
    public ActorBlock {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
    }
}
