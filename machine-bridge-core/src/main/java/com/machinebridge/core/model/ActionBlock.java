package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Action block, produced by {@code entry}, {@code exit} and transition {@code actions}.
 *
 * @param id block id
 * @param parentId owning node or edge id
 * @param sourceId implementation name or inline marker
 * @param properties action properties
 */
@JsonTypeName("action")
public record ActionBlock(String id, String parentId, String sourceId, ActionProperties properties) implements Block {

    /**
     * Compact constructor with validation.
     */
    public ActionBlock {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
    }
}
