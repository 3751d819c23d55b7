package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Inserts text at an offset.
 *
 * @param fileName target file
 * @param position insertion offset
 * @param newText inserted text
 */
@JsonTypeName("insert")
public record InsertTextEdit(String fileName, int position, String newText) implements TextEdit {

    public InsertTextEdit {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(newText, "newText must not be null");
    }

    @JsonIgnore
    @Override
    public int startOffset() {
        return position;
    }

    @JsonIgnore
    @Override
    public int endOffset() {
        return position;
    }
}
