package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A soft extraction error.
 *
 * @param type error category
 * @param detail optional detail such as the offending property kind
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionError(ExtractionErrorType type, String detail) {

    public ExtractionError {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ExtractionError of(ExtractionErrorType type) {
        return new ExtractionError(type, null);
    }
}
