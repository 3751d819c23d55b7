package com.machinebridge.core.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation of a {@link Patch}.
 */
public enum PatchOp {
    ADD("add"),
    REMOVE("remove"),
    REPLACE("replace");

    private final String code;

    PatchOp(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Looks up an operation by its JSON code.
     *
     * @param code {@code add}, {@code remove} or {@code replace}
     * @return matching operation
     * @throws IllegalArgumentException if the code is unknown
     */
    @JsonCreator
    public static PatchOp fromCode(String code) {
        for (PatchOp op : values()) {
            if (op.code.equals(code)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown patch operation: " + code);
    }
}
