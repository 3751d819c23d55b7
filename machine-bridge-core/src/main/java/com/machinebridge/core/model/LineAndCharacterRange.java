package com.machinebridge.core.model;

import java.util.Objects;

/**
 * Line/column form of a {@link TextRange}.
 *
 * @param start start position
 * @param end end position
 */
public record LineAndCharacterRange(LineAndCharacter start, LineAndCharacter end) {

    /**
     * Compact constructor with validation.
     */
    public LineAndCharacterRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }
}
