package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Deletes a range.
 *
 * @param fileName target file
 * @param range deleted range
 */
@JsonTypeName("delete")
public record DeleteTextEdit(String fileName, TextRange range) implements TextEdit {

    public DeleteTextEdit {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(range, "range must not be null");
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
