package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Soft error categories reported by extraction.
 */
public enum ExtractionErrorType {
    STATE_UNHANDLED("state_unhandled"),
    STATE_PROPERTY_UNHANDLED("state_property_unhandled"),
    STATE_PROPERTY_INVALID("state_property_invalid"),
    STATE_TYPE_INVALID("state_type_invalid"),
    STATE_HISTORY_INVALID("state_history_invalid"),
    TRANSITION_PROPERTY_UNHANDLED("transition_property_unhandled"),
    TRANSITION_TARGET_UNRESOLVED("transition_target_unresolved"),
    ACTION_UNHANDLED("action_unhandled"),
    PROPERTY_KEY_UNHANDLED("property_key_unhandled"),
    PROPERTY_KEY_NO_ROUNDTRIP("property_key_no_roundtrip"),
    PROPERTY_UNHANDLED("property_unhandled");

    private final String code;

    ExtractionErrorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ExtractionErrorType fromCode(String code) {
        for (ExtractionErrorType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown extraction error type: " + code);
    }
}
