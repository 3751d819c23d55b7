package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * History depth of a history state.
 */
public enum HistoryType {
    SHALLOW("shallow"),
    DEEP("deep");

    private final String code;

    HistoryType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static HistoryType fromCode(String code) {
        for (HistoryType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown history type: " + code);
    }
}
