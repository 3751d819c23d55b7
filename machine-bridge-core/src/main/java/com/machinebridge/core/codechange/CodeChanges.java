package com.machinebridge.core.codechange;

import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.extraction.PropertyKeys;
import com.machinebridge.core.model.ReplaceTextEdit;
import com.machinebridge.core.model.TextEdit;
import com.machinebridge.core.model.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects changes against the original text of one source file and renders them as text edits.
 *
 * <p>Every change addresses literals of the unmodified source. Nothing is rendered until
 * {@link #getTextEdits()}, so a change can build on an insertion made earlier in the same batch:
 * two transitions added to a state without {@code on} end up in a single {@code on} object, and
 * a transition added to a state created by the same batch is written inside that new state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeChanges changes = new CodeChanges(sourceFile);
 * changes.insertAtOptionalObjectPath(ObjectTarget.source(stateLiteral),
 *     List.of("on", "NEXT"), CodeElements.string("b"), null);
 * List<TextEdit> edits = changes.getTextEdits();
 * }</pre>
 */
public final class CodeChanges {

    private static final Logger log = LoggerFactory.getLogger(CodeChanges.class);

    private record Replacement(TextRange range, CodeElement element) {
    }

    private final SourceFile sourceFile;
    private final CodeRenderer renderer;
    private final Map<JsAst.ObjectLiteral, ListEdits> objectEdits = new IdentityHashMap<>();
    private final Map<JsAst.ArrayLiteral, ListEdits> arrayEdits = new IdentityHashMap<>();
    private final Map<JsAst.Expression, ArrayElement> wrappedValues = new IdentityHashMap<>();
    private final List<Replacement> replacements = new ArrayList<>();

    public CodeChanges(SourceFile sourceFile) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        this.renderer = new CodeRenderer(sourceFile.preferredQuote());
    }

    /**
     * Inserts a value at a property path below an object, creating the missing objects on the way.
     *
     * <p>Path segments are property keys ({@link String}) or array indices ({@link Integer}); an
     * index may also address an object that is written without array brackets when the index is
     * 0. Only the first missing property is placed by {@code priority}; properties nested inside
     * it are new anyway. A final key that already exists turns into an array: the value is
     * appended to an existing array literal, or the existing value is wrapped as
     * {@code [existing, value]}.
     *
     * @param target object to start from
     * @param path property path, not empty
     * @param value value to insert
     * @param priority placement of the first created property, or null to append
     * @return the property holding {@code value}, or empty if the value was added to an array
     * @throws IllegalStateException if the path runs into something other than an object literal
     */
    public Optional<PropertyElement> insertAtOptionalObjectPath(
            ObjectTarget target, List<?> path, CodeElement value, InsertionPriority priority) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        ObjectTarget current = target;
        int i = 0;
        while (true) {
            String key = keySegment(path, i);
            boolean last = i == path.size() - 1;
            Existing existing = find(current, key);

            if (existing == null) {
                return Optional.of(insertNested(current, path, i, value, priority));
            }
            if (last) {
                appendToExisting(existing, value);
                return Optional.empty();
            }

            i++;
            Object next = path.get(i);
            if (next instanceof Integer index) {
                current = descendIndex(existing, index, path);
                i++;
                if (i == path.size()) {
                    throw new IllegalStateException("Path must end with a property key: " + path);
                }
            } else {
                current = descendObject(existing, path);
            }
        }
    }

    /**
     * Inserts a property into an object at the position its priority calls for.
     *
     * @param target object to insert into
     * @param key property key
     * @param value property value
     * @param priority insertion priority, or null to append
     * @return the new property
     */
    public PropertyElement insertPropertyIntoObject(
            ObjectTarget target, String key, CodeElement value, InsertionPriority priority) {
        PropertyElement property = CodeElements.property(key, value);
        place(target, property, priority);
        return property;
    }

    /**
     * Inserts a property right before an existing one.
     *
     * @param object object containing {@code anchor}
     * @param anchor existing property
     * @param key new property key
     * @param value new property value
     * @return the new property
     */
    public PropertyElement insertPropertyBeforeProperty(
            JsAst.ObjectLiteral object, JsAst.PropertyAssignment anchor, String key, CodeElement value) {
        PropertyElement property = CodeElements.property(key, value);
        edits(object).insert(Anchor.before(indexOf(object, anchor)), property);
        return property;
    }

    /**
     * Rewrites the name of a property, leaving its value untouched.
     *
     * @param property existing property
     * @param name new key
     */
    public void replacePropertyName(JsAst.PropertyAssignment property, String name) {
        String text = StringLiterals.propertyName(name, sourceFile.preferredQuote());
        replaceRange(property.name().range(), CodeElements.raw(text));
    }

    /**
     * Replaces a source range with a rendered element.
     *
     * @param range range of the original text
     * @param value replacement
     */
    public void replaceRange(TextRange range, CodeElement value) {
        replacements.removeIf(replacement -> replacement.range().equals(range));
        replacements.add(new Replacement(range, value));
    }

    /**
     * Returns a property this batch has inserted into a source object and not written yet.
     *
     * @param object source object literal
     * @param key property key
     * @return the pending property, if any
     */
    public Optional<PropertyElement> pendingProperty(JsAst.ObjectLiteral object, String key) {
        ListEdits edits = objectEdits.get(object);
        if (edits == null) {
            return Optional.empty();
        }
        return edits.pendingElements().stream()
            .filter(PropertyElement.class::isInstance)
            .map(PropertyElement.class::cast)
            .filter(property -> property.key().equals(key))
            .findFirst();
    }

    /**
     * Removes a property together with the separator that belongs to it.
     *
     * @param object object containing the property
     * @param property property to remove
     */
    public void removeProperty(JsAst.ObjectLiteral object, JsAst.PropertyAssignment property) {
        edits(object).remove(indexOf(object, property));
    }

    /**
     * Takes back an earlier removal of a property in this batch.
     *
     * @param object object containing the property
     * @param property property whose removal is dropped
     * @return true if the property was queued for removal
     */
    public boolean restoreProperty(JsAst.ObjectLiteral object, JsAst.PropertyAssignment property) {
        ListEdits edits = objectEdits.get(object);
        int index = indexOf(object, property);
        if (edits == null || !edits.isRemoved(index)) {
            return false;
        }
        edits.restore(index);
        return true;
    }

    /**
     * Returns whether this batch removes a property of a source object.
     *
     * @param object object containing the property
     * @param property property of the original source
     * @return true if the property is queued for removal
     */
    public boolean isRemoved(JsAst.ObjectLiteral object, JsAst.PropertyAssignment property) {
        ListEdits edits = objectEdits.get(object);
        return edits != null && edits.isRemoved(indexOf(object, property));
    }

    /**
     * Removes an array element together with the separator that belongs to it.
     *
     * @param array array literal
     * @param index element index
     */
    public void removeElement(JsAst.ArrayLiteral array, int index) {
        arrayEdits.computeIfAbsent(array, key -> new ListEdits(LiteralList.of(key))).remove(index);
    }

    /**
     * Drops a property that an earlier change of this batch inserted.
     *
     * @param property pending property
     * @return true if the property was found and dropped
     */
    public boolean discard(PropertyElement property) {
        for (ListEdits edits : objectEdits.values()) {
            if (edits.discard(property)) {
                return true;
            }
        }
        for (ArrayElement wrapped : wrappedValues.values()) {
            if (CodeElements.discardFrom(wrapped, property)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders all collected changes.
     *
     * @return non-overlapping edits in ascending offset order
     */
    public List<TextEdit> getTextEdits() {
        ListEdits.Layout layout = new ListEdits.Layout(detectNewline(), detectIndentUnit());
        List<TextEdit> edits = new ArrayList<>();
        for (Replacement replacement : replacements) {
            edits.add(new ReplaceTextEdit(sourceFile.fileName(), replacement.range(),
                renderer.render(replacement.element())));
        }
        objectEdits.values().forEach(listEdits -> listEdits.render(sourceFile, renderer, layout, edits));
        arrayEdits.values().forEach(listEdits -> listEdits.render(sourceFile, renderer, layout, edits));

        List<TextEdit> result = TextEdits.normalize(edits);
        log.debug("Rendered {} edit(s) for {}", result.size(), sourceFile.fileName());
        return result;
    }

    /**
     * An existing property, either in the source or pending.
     */
    private record Existing(JsAst.Expression sourceValue, PropertyElement pending) {
    }

    private Existing find(ObjectTarget target, String key) {
        if (target instanceof ObjectTarget.PendingObject pending) {
            return pending.element().find(key).map(property -> new Existing(null, property)).orElse(null);
        }
        ObjectTarget.SourceObject source = (ObjectTarget.SourceObject) target;
        JsAst.ObjectLiteral literal = source.literal();
        Optional<JsAst.PropertyAssignment> property = source.lastKeyWins()
            ? PropertyKeys.findLast(literal, key)
            : PropertyKeys.findFirst(literal, key);
        property = property.filter(found -> !isRemoved(literal, found));
        if (property.isPresent()) {
            return new Existing(property.get().value(), null);
        }
        return pendingProperty(literal, key).map(pending -> new Existing(null, pending)).orElse(null);
    }

    private PropertyElement insertNested(
            ObjectTarget target, List<?> path, int from, CodeElement value, InsertionPriority priority) {
        PropertyElement innermost = CodeElements.property(keySegment(path, path.size() - 1), value);
        PropertyElement outer = innermost;
        for (int j = path.size() - 2; j >= from; j--) {
            outer = CodeElements.property(keySegment(path, j), CodeElements.object(outer));
        }
        place(target, outer, priority);
        return innermost;
    }

    private void place(ObjectTarget target, PropertyElement property, InsertionPriority priority) {
        if (target instanceof ObjectTarget.PendingObject pending) {
            pending.element().insert(property, priority);
        } else if (target instanceof ObjectTarget.SourceObject source) {
            JsAst.ObjectLiteral literal = source.literal();
            List<String> keys = literal.members().stream().map(CodeChanges::memberKey).toList();
            edits(literal).insert(InsertionPriority.anchorFor(keys, priority), property);
        }
    }

    private void appendToExisting(Existing existing, CodeElement value) {
        if (existing.pending() != null) {
            PropertyElement property = existing.pending();
            if (property.value() instanceof ArrayElement array) {
                array.add(value);
            } else {
                property.setValue(CodeElements.array(property.value(), value));
            }
            return;
        }
        JsAst.Expression sourceValue = existing.sourceValue();
        if (sourceValue instanceof JsAst.ArrayLiteral array) {
            arrayEdits.computeIfAbsent(array, key -> new ListEdits(LiteralList.of(key))).insert(Anchor.END, value);
            return;
        }
        ArrayElement wrapped = wrappedValues.get(sourceValue);
        if (wrapped == null) {
            wrapped = CodeElements.array(CodeElements.raw(sourceFile.textOf(sourceValue.range())));
            wrappedValues.put(sourceValue, wrapped);
            replacements.add(new Replacement(sourceValue.range(), wrapped));
        }
        wrapped.add(value);
    }

    private ObjectTarget descendObject(Existing existing, List<?> path) {
        if (existing.pending() != null) {
            if (existing.pending().value() instanceof ObjectElement object) {
                return ObjectTarget.pending(object);
            }
        } else if (existing.sourceValue() instanceof JsAst.ObjectLiteral literal) {
            return ObjectTarget.source(literal);
        }
        throw new IllegalStateException("Expected an object literal along " + path);
    }

    private ObjectTarget descendIndex(Existing existing, int index, List<?> path) {
        if (existing.pending() != null) {
            CodeElement value = existing.pending().value();
            if (value instanceof ArrayElement array && index < array.elements().size()
                && array.elements().get(index) instanceof ObjectElement object) {
                return ObjectTarget.pending(object);
            }
            if (value instanceof ObjectElement object && index == 0) {
                return ObjectTarget.pending(object);
            }
        } else {
            JsAst.Expression value = existing.sourceValue();
            if (value instanceof JsAst.ArrayLiteral array && index < array.elements().size()
                && array.elements().get(index) instanceof JsAst.ObjectLiteral literal) {
                return ObjectTarget.sourceEntry(literal);
            }
            if (value instanceof JsAst.ObjectLiteral literal && index == 0) {
                return ObjectTarget.sourceEntry(literal);
            }
        }
        throw new IllegalStateException("Expected an object literal at index " + index + " along " + path);
    }

    private ListEdits edits(JsAst.ObjectLiteral object) {
        return objectEdits.computeIfAbsent(object, key -> new ListEdits(LiteralList.of(key)));
    }

    private static String keySegment(List<?> path, int index) {
        Object segment = path.get(index);
        if (segment instanceof String key) {
            return key;
        }
        throw new IllegalStateException("Expected a property key at position " + index + " of " + path);
    }

    private static String memberKey(JsAst.Member member) {
        if (member instanceof JsAst.PropertyAssignment property) {
            return PropertyKeys.staticKey(property.name()).orElse(null);
        }
        return null;
    }

    private static int indexOf(JsAst.ObjectLiteral object, JsAst.Member member) {
        List<JsAst.Member> members = object.members();
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) == member) {
                return i;
            }
        }
        throw new IllegalArgumentException("Member is not part of the object literal");
    }

    private String detectNewline() {
        return sourceFile.text().contains("\r\n") ? "\r\n" : "\n";
    }

    /**
     * Indentation of the first indented line, two spaces when no line is indented.
     */
    private String detectIndentUnit() {
        String text = sourceFile.text();
        int lineStart = 0;
        while (lineStart < text.length()) {
            int end = lineStart;
            while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                end++;
            }
            // block comment continuation lines are not code indentation
            if (end > lineStart && end < text.length() && "\r\n*".indexOf(text.charAt(end)) < 0) {
                return text.charAt(lineStart) == '\t' ? "\t" : text.substring(lineStart, end);
            }
            int newline = text.indexOf('\n', end);
            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        return "  ";
    }
}
