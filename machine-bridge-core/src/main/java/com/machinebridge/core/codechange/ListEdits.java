package com.machinebridge.core.codechange;

import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.model.DeleteTextEdit;
import com.machinebridge.core.model.InsertTextEdit;
import com.machinebridge.core.model.ReplaceTextEdit;
import com.machinebridge.core.model.TextEdit;
import com.machinebridge.core.model.TextRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Insertions into and removals from one object or array literal of the source.
 *
 * <p>New items follow the layout of the literal: a multi-line literal gets one item per line at
 * the indentation of its first item, a single-line literal gets {@code ", "} separators, and an
 * existing trailing comma is kept.
 */
final class ListEdits {

    private record Insertion(Anchor anchor, CodeElement element) {
    }

    private final LiteralList list;
    private final List<Insertion> insertions = new ArrayList<>();
    private final TreeSet<Integer> removals = new TreeSet<>();

    ListEdits(LiteralList list) {
        this.list = list;
    }

    void insert(Anchor anchor, CodeElement element) {
        insertions.add(new Insertion(anchor, element));
    }

    void remove(int index) {
        if (index < 0 || index >= list.size()) {
            throw new IllegalArgumentException("No item at index " + index);
        }
        removals.add(index);
    }

    boolean isRemoved(int index) {
        return removals.contains(index);
    }

    void restore(int index) {
        removals.remove(index);
    }

    /**
     * Returns elements inserted so far, in insertion order.
     */
    List<CodeElement> pendingElements() {
        return insertions.stream().map(Insertion::element).toList();
    }

    boolean discard(PropertyElement property) {
        if (insertions.removeIf(insertion -> insertion.element() == property)) {
            return true;
        }
        for (Insertion insertion : insertions) {
            if (CodeElements.discardFrom(insertion.element(), property)) {
                return true;
            }
        }
        return false;
    }

    void render(SourceFile file, CodeRenderer renderer, Layout layout, List<TextEdit> out) {
        int size = list.size();
        if (size == 0 || removals.size() == size) {
            if (!insertions.isEmpty() || size > 0) {
                renderInto(file, renderer, layout, out);
            }
            return;
        }
        renderRemovals(file, out);
        renderInsertions(file, renderer, layout, out);
    }

    /**
     * Replaces the whole content of a literal that is empty or emptied.
     */
    private void renderInto(SourceFile file, CodeRenderer renderer, Layout layout, List<TextEdit> out) {
        List<String> texts = canonicalOrder(pendingElements()).stream().map(renderer::render).toList();
        TextRange range = list.range();
        String newText;
        if (texts.isEmpty()) {
            newText = "";
        } else if (!file.sameLine(range.start(), range.end() - 1)) {
            String indent = file.lineIndentAt(range.start()) + layout.indentUnit();
            String closingIndent = file.lineIndentAt(range.end() - 1);
            newText = layout.newline() + indent
                + String.join("," + layout.newline() + indent, texts)
                + layout.newline() + closingIndent;
        } else if (list.padded()) {
            newText = " " + String.join(", ", texts) + " ";
        } else {
            newText = String.join(", ", texts);
        }
        out.add(edit(file.fileName(), list.inner(), newText));
    }

    private void renderRemovals(SourceFile file, List<TextEdit> out) {
        List<Integer> sorted = new ArrayList<>(removals);
        int i = 0;
        while (i < sorted.size()) {
            int first = sorted.get(i);
            int last = first;
            while (i + 1 < sorted.size() && sorted.get(i + 1) == last + 1) {
                i++;
                last++;
            }
            i++;

            int start;
            int end;
            if (last + 1 < list.size()) {
                start = list.items().get(first).start();
                end = list.items().get(last + 1).start();
            } else {
                // the run reaches the end, so a kept item precedes it
                int comma = list.commas().get(first - 1);
                start = comma >= 0 ? comma : list.items().get(first - 1).end();
                end = list.items().get(last).end();
            }
            out.add(new DeleteTextEdit(file.fileName(), new TextRange(start, end)));
        }
    }

    private void renderInsertions(SourceFile file, CodeRenderer renderer, Layout layout, List<TextEdit> out) {
        if (insertions.isEmpty()) {
            return;
        }
        List<TextRange> items = list.items();
        boolean multiline = !file.sameLine(list.range().start(), items.get(0).start());
        String indent = multiline ? file.lineIndentAt(items.get(0).start()) : "";
        String separator = multiline ? "," + layout.newline() + indent : ", ";
        String lead = multiline ? layout.newline() + indent : " ";

        Map<Anchor, List<CodeElement>> grouped = new LinkedHashMap<>();
        for (Insertion insertion : insertions) {
            grouped.computeIfAbsent(surviving(insertion.anchor().normalize(items.size())), anchor -> new ArrayList<>())
                .add(insertion.element());
        }

        grouped.forEach((anchor, elements) -> {
            String text = canonicalOrder(elements).stream()
                .map(renderer::render)
                .collect(Collectors.joining(separator));
            TextRange item = items.get(anchor.index());
            if (anchor.placement() == Anchor.Placement.BEFORE) {
                out.add(new InsertTextEdit(file.fileName(), item.start(), text + separator));
                return;
            }
            int comma = list.commas().get(anchor.index());
            if (comma >= 0 && !removedToEnd(anchor.index() + 1)) {
                out.add(new InsertTextEdit(file.fileName(), comma + 1, lead + text + ","));
            } else {
                out.add(new InsertTextEdit(file.fileName(), item.end(), separator + text));
            }
        });
    }

    /**
     * Moves an anchor off a removed item onto the nearest kept one, keeping its position among
     * the kept items. At least one item is kept when this is called.
     */
    private Anchor surviving(Anchor anchor) {
        if (!removals.contains(anchor.index())) {
            return anchor;
        }
        int previous = anchor.index() - 1;
        while (previous >= 0 && removals.contains(previous)) {
            previous--;
        }
        int next = anchor.index() + 1;
        while (next < list.size() && removals.contains(next)) {
            next++;
        }
        boolean preferPrevious = anchor.placement() == Anchor.Placement.AFTER || next == list.size();
        return preferPrevious && previous >= 0 ? Anchor.after(previous) : Anchor.before(next);
    }

    /**
     * True if every item from {@code index} on is removed; their deletion then starts at the
     * comma in front of {@code index}.
     */
    private boolean removedToEnd(int index) {
        if (index >= list.size()) {
            return false;
        }
        for (int i = index; i < list.size(); i++) {
            if (!removals.contains(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Properties sharing an anchor keep the canonical order among themselves.
     */
    private static List<CodeElement> canonicalOrder(List<CodeElement> elements) {
        List<CodeElement> ordered = new ArrayList<>(elements);
        ordered.sort(Comparator.<CodeElement>comparingInt(ListEdits::rank).reversed());
        return ordered;
    }

    private static int rank(CodeElement element) {
        return element instanceof PropertyElement property ? InsertionPriority.rankOf(property.key()) : 0;
    }

    private static TextEdit edit(String fileName, TextRange range, String newText) {
        if (range.length() == 0) {
            return new InsertTextEdit(fileName, range.start(), newText);
        }
        if (newText.isEmpty()) {
            return new DeleteTextEdit(fileName, range);
        }
        return new ReplaceTextEdit(fileName, range, newText);
    }

    /**
     * Line break and indentation unit of the file being edited.
     */
    record Layout(String newline, String indentUnit) {
    }
}
