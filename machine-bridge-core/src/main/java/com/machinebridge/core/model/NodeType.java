package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a state node.
 */
public enum NodeType {
    /** Atomic or compound state */
    NORMAL("normal"),

    /** History pseudo-state */
    HISTORY("history"),

    /** Parallel state, all children active */
    PARALLEL("parallel"),

    /** Final state */
    FINAL("final");

    private final String code;

    NodeType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Looks up a type by its configuration code.
     *
     * @param code code such as {@code "parallel"}
     * @return matching type
     * @throws IllegalArgumentException if the code is unknown
     */
    @JsonCreator
    public static NodeType fromCode(String code) {
        for (NodeType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + code);
    }
}
