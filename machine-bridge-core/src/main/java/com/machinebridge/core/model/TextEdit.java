package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A text edit against one file. Serialized with a {@code type} discriminator.
 *
 * <p>All edits of one batch are computed against the same original text and must be applied
 * together.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InsertTextEdit.class, name = "insert"),
    @JsonSubTypes.Type(value = DeleteTextEdit.class, name = "delete"),
    @JsonSubTypes.Type(value = ReplaceTextEdit.class, name = "replace")
})
public interface TextEdit {

    String fileName();

    /**
     * Offset where the edit starts; edits are applied in descending order of this offset.
     */
    int startOffset();

    /**
     * Offset where the edit ends, equal to {@link #startOffset()} for insertions.
     */
    int endOffset();
}
