package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An action or actor attached to a node or edge. Serialized with a {@code blockType}
 * discriminator.
 *
 * <p>{@link #sourceId()} names the referenced implementation, or is an {@code inline:<token>}
 * marker when the implementation is written inline.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "blockType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ActionBlock.class, name = "action"),
    @JsonSubTypes.Type(value = ActorBlock.class, name = "actor")
})
public interface Block {

    String INLINE_PREFIX = "inline:";

    String id();

    /**
     * Owning node or edge id.
     */
    String parentId();

    String sourceId();
}
