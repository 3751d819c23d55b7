package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Replaces a range with new text.
 *
 * @param fileName target file
 * @param range replaced range
 * @param newText replacement text
 */
@JsonTypeName("replace")
public record ReplaceTextEdit(String fileName, TextRange range, String newText) implements TextEdit {

    public ReplaceTextEdit {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(newText, "newText must not be null");
    }

    @JsonIgnore
    @Override
    public int startOffset() {
        return range.start();
    }

    @JsonIgnore
    @Override
    public int endOffset() {
        return range.end();
    }
}
