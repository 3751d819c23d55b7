package com.machinebridge.core.codechange;

import com.machinebridge.core.model.DeleteTextEdit;
import com.machinebridge.core.model.InsertTextEdit;
import com.machinebridge.core.model.ReplaceTextEdit;
import com.machinebridge.core.model.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering and application of {@link TextEdit} batches.
 */
public final class TextEdits {

    /**
     * Ascending start offset; at equal starts the shorter edit first, so that an insertion at
     * the start of a deleted range stays in front of it.
     */
    static final Comparator<TextEdit> ORDER = Comparator.comparingInt(TextEdit::startOffset)
        .thenComparingInt(TextEdit::endOffset);

    private TextEdits() {
        // Utility class - no instantiation
    }

    /**
     * Applies a batch of edits computed against {@code text}.
     *
     * <p>Edits are applied from the end of the text backwards so that the offsets of the
     * remaining edits stay valid.
     *
     * @param text original text
     * @param edits edits against the original text
     * @return edited text
     * @throws IllegalArgumentException if an edit lies outside the text
     */
    public static String apply(String text, List<? extends TextEdit> edits) {
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(ORDER.reversed());
        StringBuilder out = new StringBuilder(text);
        for (TextEdit edit : ordered) {
            if (edit.startOffset() < 0 || edit.endOffset() > text.length()) {
                throw new IllegalArgumentException("Edit out of bounds: " + edit);
            }
            if (edit instanceof InsertTextEdit insert) {
                out.insert(insert.position(), insert.newText());
            } else if (edit instanceof DeleteTextEdit delete) {
                out.delete(delete.range().start(), delete.range().end());
            } else if (edit instanceof ReplaceTextEdit replace) {
                out.replace(replace.range().start(), replace.range().end(), replace.newText());
            } else {
                throw new IllegalArgumentException("Unsupported edit: " + edit);
            }
        }
        return out.toString();
    }

    /**
     * Sorts edits and drops those that fall inside a deleted range.
     */
    static List<TextEdit> normalize(List<TextEdit> edits) {
        List<DeleteTextEdit> deletions = edits.stream()
            .filter(DeleteTextEdit.class::isInstance)
            .map(DeleteTextEdit.class::cast)
            .toList();
        List<TextEdit> kept = new ArrayList<>();
        for (TextEdit edit : edits) {
            if (deletions.stream().noneMatch(deletion -> deletion != edit && swallows(deletion, edit))) {
                kept.add(edit);
            }
        }
        kept.sort(ORDER);
        return List.copyOf(kept);
    }

    private static boolean swallows(DeleteTextEdit deletion, TextEdit edit) {
        int start = deletion.range().start();
        int end = deletion.range().end();
        if (edit instanceof InsertTextEdit insert) {
            return insert.position() > start && insert.position() < end;
        }
        return edit.startOffset() >= start && edit.endOffset() <= end
            && (edit.startOffset() > start || edit.endOffset() < end);
    }
}
