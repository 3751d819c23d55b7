package com.machinebridge.core.model;

import java.util.Objects;

/**
 * Properties of an {@link ActorBlock}.
 *
 * @param src actor source, equal to the block's source id
 * @param id invocation id, or an inline marker when none is declared
 */
public record ActorProperties(String src, String id) {

    public ActorProperties {
        Objects.requireNonNull(src, "src must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }
}
