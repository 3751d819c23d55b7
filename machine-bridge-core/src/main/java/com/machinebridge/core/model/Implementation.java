package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Canonical descriptor of a referenced implementation.
 *
 * @param type implementation kind: {@code action}, {@code actor} or {@code guard}
 * @param id source id
 * @param name display name
 * @param jsImplementation source text of an inline implementation, null for named ones
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Implementation(String type, String id, String name, String jsImplementation) {

    public static final String ACTION = "action";
    public static final String ACTOR = "actor";
    public static final String GUARD = "guard";

    public Implementation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
