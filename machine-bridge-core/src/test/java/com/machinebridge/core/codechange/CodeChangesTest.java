package com.machinebridge.core.codechange;

import com.machinebridge.core.MachineTestBase;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.extraction.PropertyKeys;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CodeChanges}.
 */
class CodeChangesTest extends MachineTestBase {

    @Test
    void insertAtOptionalObjectPath_emptyObject_createsNestedObjects() {
        SourceFile file = parse("createMachine({ states: { a: {} } });");
        CodeChanges changes = new CodeChanges(file);

        changes.insertAtOptionalObjectPath(ObjectTarget.source(object(file, "states", "a")),
            List.of("on", "GO"), CodeElements.string("b"), null);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ states: { a: { on: { GO: \"b\" } } } });");
    }

    @Test
    void insertAtOptionalObjectPath_sameMissingParent_mergesIntoOneObject() {
        SourceFile file = parse("createMachine({ states: { a: {} } });");
        CodeChanges changes = new CodeChanges(file);
        ObjectTarget a = ObjectTarget.source(object(file, "states", "a"));

        changes.insertAtOptionalObjectPath(a, List.of("on", "A"), CodeElements.string("x"), null);
        changes.insertAtOptionalObjectPath(a, List.of("on", "B"), CodeElements.string("y"), null);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ states: { a: { on: { A: \"x\", B: \"y\" } } } });");
    }

    @Test
    void insertAtOptionalObjectPath_existingValue_becomesArray() {
        SourceFile file = parse("createMachine({ on: { GO: \"b\", STOP: [\"c\"] } });");
        CodeChanges changes = new CodeChanges(file);
        ObjectTarget root = ObjectTarget.source(object(file));

        Optional<PropertyElement> wrapped = changes.insertAtOptionalObjectPath(root, List.of("on", "GO"), CodeElements.string("x"), null);
        changes.insertAtOptionalObjectPath(root, List.of("on", "STOP"), CodeElements.string("y"), null);

        assertThat(wrapped).isEmpty();
        assertThat(applied(file, changes)).isEqualTo("createMachine({ on: { GO: [\"b\", \"x\"], STOP: [\"c\", \"y\"] } });");
    }

    @Test
    void insertAtOptionalObjectPath_indexIntoInvoke_descendsIntoElement() {
        SourceFile file = parse("createMachine({ invoke: [{ src: \"a\" }, { src: \"b\" }] });");
        CodeChanges changes = new CodeChanges(file);

        changes.insertAtOptionalObjectPath(ObjectTarget.source(object(file)),
            List.of("invoke", 1, "onDone"), CodeElements.string("done"), null);

        assertThat(applied(file, changes))
            .isEqualTo("createMachine({ invoke: [{ src: \"a\" }, { src: \"b\", onDone: \"done\" }] });");
    }

    @Test
    void insertAtOptionalObjectPath_throughNonObject_throws() {
        SourceFile file = parse("createMachine({ on: \"oops\" });");
        CodeChanges changes = new CodeChanges(file);

        assertThatThrownBy(() -> changes.insertAtOptionalObjectPath(ObjectTarget.source(object(file)),
            List.of("on", "GO"), CodeElements.string("b"), null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertPropertyIntoObject_multilineWithTrailingComma_followsLayout() {
        String text = """
            createMachine({
              states: {
                a: {
                  entry: "x",
                },
              },
            });
            """;
        SourceFile file = parse(text);
        CodeChanges changes = new CodeChanges(file);

        changes.insertPropertyIntoObject(ObjectTarget.source(object(file, "states", "a")), "description",
            CodeElements.string("hi"), null);

        assertThat(applied(file, changes)).isEqualTo("""
            createMachine({
              states: {
                a: {
                  entry: "x",
                  description: "hi",
                },
              },
            });
            """);
    }

    @Test
    void insertPropertyIntoObject_multilineWithoutTrailingComma_addsSeparator() {
        String text = """
            createMachine({
              states: {
                a: {
                  entry: "x"
                }
              }
            });
            """;
        SourceFile file = parse(text);
        CodeChanges changes = new CodeChanges(file);

        changes.insertPropertyIntoObject(ObjectTarget.source(object(file, "states", "a")), "description",
            CodeElements.string("hi"), null);

        assertThat(applied(file, changes)).isEqualTo("""
            createMachine({
              states: {
                a: {
                  entry: "x",
                  description: "hi"
                }
              }
            });
            """);
    }

    @Test
    void insertPropertyIntoObject_emptyMultilineObject_indentsOneLevel() {
        String text = """
            createMachine({
              states: {
              },
            });
            """;
        SourceFile file = parse(text);
        CodeChanges changes = new CodeChanges(file);

        changes.insertPropertyIntoObject(ObjectTarget.source(object(file, "states")), "a", CodeElements.object(), null);

        assertThat(applied(file, changes)).isEqualTo("""
            createMachine({
              states: {
                a: {}
              },
            });
            """);
    }

    @Test
    void insertPropertyIntoObject_priority_placesCanonically() {
        SourceFile file = parse("createMachine({ entry: \"x\", states: {} });");
        CodeChanges changes = new CodeChanges(file);
        ObjectTarget root = ObjectTarget.source(object(file));

        changes.insertPropertyIntoObject(root, "initial", CodeElements.string("a"), InsertionPriority.INITIAL);
        changes.insertPropertyIntoObject(root, "type", CodeElements.string("parallel"), InsertionPriority.STATE_TYPE);

        assertThat(applied(file, changes))
            .isEqualTo("createMachine({ type: \"parallel\", initial: \"a\", entry: \"x\", states: {} });");
    }

    @Test
    void insertPropertyBeforeProperty_insertsAheadOfAnchor() {
        SourceFile file = parse("createMachine({ id: \"m\", states: {} });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);

        changes.insertPropertyBeforeProperty(root, PropertyKeys.findFirst(root, "states").orElseThrow(),
            "initial", CodeElements.string("a"));

        assertThat(applied(file, changes)).isEqualTo("createMachine({ id: \"m\", initial: \"a\", states: {} });");
    }

    @Test
    void removeProperty_middleLastAndAll() {
        String text = "createMachine({ a: 1, b: 2, c: 3 });";

        assertThat(removing(text, "b")).isEqualTo("createMachine({ a: 1, c: 3 });");
        assertThat(removing(text, "c")).isEqualTo("createMachine({ a: 1, b: 2 });");
        assertThat(removing(text, "a")).isEqualTo("createMachine({ b: 2, c: 3 });");
        assertThat(removing(text, "b", "c")).isEqualTo("createMachine({ a: 1 });");
        assertThat(removing(text, "a", "b", "c")).isEqualTo("createMachine({});");
    }

    @Test
    void removeProperty_multiline_removesWholeLine() {
        String text = """
            createMachine({
              a: 1,
              b: 2,
              c: 3,
            });
            """;

        assertThat(removing(text, "b")).isEqualTo("""
            createMachine({
              a: 1,
              c: 3,
            });
            """);
    }

    @Test
    void removeElement_dropsElementAndSeparator() {
        SourceFile file = parse("createMachine({ on: { GO: [\"a\", \"b\", \"c\"] } });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ArrayLiteral array = (JsAst.ArrayLiteral) PropertyKeys.findFirst(object(file, "on"), "GO").orElseThrow().value();

        changes.removeElement(array, 1);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ on: { GO: [\"a\", \"c\"] } });");
    }

    @Test
    void removeAndInsert_sameObject_combine() {
        SourceFile file = parse("createMachine({ a: 1, b: 2 });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);

        changes.removeProperty(root, PropertyKeys.findFirst(root, "b").orElseThrow());
        changes.insertPropertyIntoObject(ObjectTarget.source(root), "c", CodeElements.raw("3"), null);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ a: 1, c: 3 });");
    }

    @Test
    void removeAndInsert_anchorOnRemovedProperty_movesToKeptNeighbour() {
        SourceFile file = parse("createMachine({ type: \"final\", entry: \"x\" });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);

        changes.removeProperty(root, PropertyKeys.findFirst(root, "type").orElseThrow());
        changes.insertPropertyIntoObject(ObjectTarget.source(root), "history",
            CodeElements.string("deep"), InsertionPriority.HISTORY);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ history: \"deep\", entry: \"x\" });");
    }

    @Test
    void removeAndInsert_removedLastWithTrailingComma_keepsLayout() {
        SourceFile file = parse("""
            createMachine({
              a: 1,
              b: 2,
            });
            """);
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);

        changes.removeProperty(root, PropertyKeys.findFirst(root, "b").orElseThrow());
        changes.insertPropertyIntoObject(ObjectTarget.source(root), "c", CodeElements.raw("3"), null);

        assertThat(applied(file, changes)).isEqualTo("""
            createMachine({
              a: 1,
              c: 3,
            });
            """);
    }

    @Test
    void restoreProperty_removedEarlier_keepsProperty() {
        SourceFile file = parse("createMachine({ a: 1, b: 2 });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);
        JsAst.PropertyAssignment b = PropertyKeys.findFirst(root, "b").orElseThrow();

        changes.removeProperty(root, b);
        assertThat(changes.isRemoved(root, b)).isTrue();
        assertThat(changes.restoreProperty(root, b)).isTrue();
        changes.replaceRange(b.value().range(), CodeElements.raw("5"));

        assertThat(changes.isRemoved(root, b)).isFalse();
        assertThat(applied(file, changes)).isEqualTo("createMachine({ a: 1, b: 5 });");
    }

    @Test
    void insertAtOptionalObjectPath_removedKey_isWrittenAnew() {
        SourceFile file = parse("createMachine({ on: { GO: \"b\" } });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral on = object(file, "on");

        changes.removeProperty(on, PropertyKeys.findFirst(on, "GO").orElseThrow());
        Optional<PropertyElement> written = changes.insertAtOptionalObjectPath(ObjectTarget.source(object(file)),
            List.of("on", "GO"), CodeElements.string("c"), null);

        assertThat(written).isPresent();
        assertThat(applied(file, changes)).isEqualTo("createMachine({ on: { GO: \"c\" } });");
    }

    @Test
    void replacePropertyName_quotesWhenNeeded() {
        SourceFile file = parse("import { createMachine } from 'xstate';\ncreateMachine({ states: { a: {}, b: {} } });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral states = object(file, "states");

        changes.replacePropertyName(PropertyKeys.findFirst(states, "a").orElseThrow(), "first");
        changes.replacePropertyName(PropertyKeys.findFirst(states, "b").orElseThrow(), "second state");

        assertThat(applied(file, changes))
            .endsWith("createMachine({ states: { first: {}, 'second state': {} } });");
    }

    @Test
    void replaceRange_sameRangeTwice_lastWins() {
        SourceFile file = parse("createMachine({ type: \"final\" });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.Expression value = PropertyKeys.findFirst(object(file), "type").orElseThrow().value();

        changes.replaceRange(value.range(), CodeElements.string("parallel"));
        changes.replaceRange(value.range(), CodeElements.string("history"));

        assertThat(changes.getTextEdits()).hasSize(1);
        assertThat(applied(file, changes)).isEqualTo("createMachine({ type: \"history\" });");
    }

    @Test
    void discard_pendingProperty_leavesNoEdit() {
        SourceFile file = parse("createMachine({ states: {} });");
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral states = object(file, "states");

        PropertyElement added = changes.insertPropertyIntoObject(ObjectTarget.source(states), "a", CodeElements.object(), null);
        assertThat(changes.pendingProperty(states, "a")).containsSame(added);

        assertThat(changes.discard(added)).isTrue();
        assertThat(changes.getTextEdits()).isEmpty();
    }

    @Test
    void getTextEdits_crlfAndTabs_followFile() {
        String text = "createMachine({\r\n\tstates: {\r\n\t}\r\n});\r\n";
        SourceFile file = parse(text);
        CodeChanges changes = new CodeChanges(file);

        changes.insertPropertyIntoObject(ObjectTarget.source(object(file, "states")), "a", CodeElements.object(), null);

        assertThat(applied(file, changes)).isEqualTo("createMachine({\r\n\tstates: {\r\n\t\ta: {}\r\n\t}\r\n});\r\n");
    }

    @Test
    void getTextEdits_multilineDescription_usesTemplateLiteral() {
        SourceFile file = parse("createMachine({});");
        CodeChanges changes = new CodeChanges(file);

        changes.insertPropertyIntoObject(ObjectTarget.source(object(file)), "description",
            CodeElements.multilineString("line one\nline `two`"), null);

        assertThat(applied(file, changes)).isEqualTo("createMachine({ description: `line one\nline \\`two\\`` });");
    }

    private static String removing(String text, String... keys) {
        SourceFile file = parse(text);
        CodeChanges changes = new CodeChanges(file);
        JsAst.ObjectLiteral root = object(file);
        for (String key : keys) {
            changes.removeProperty(root, PropertyKeys.findFirst(root, key).orElseThrow());
        }
        return applied(file, changes);
    }

    private static String applied(SourceFile file, CodeChanges changes) {
        return TextEdits.apply(file.text(), changes.getTextEdits());
    }

    /**
     * Follows property keys from the configuration literal to an object literal.
     */
    private static JsAst.ObjectLiteral object(SourceFile file, String... keys) {
        JsAst.Expression current = file.factoryCalls().get(0).config().orElseThrow();
        for (String key : keys) {
            current = PropertyKeys.findFirst((JsAst.ObjectLiteral) current, key).orElseThrow().value();
        }
        return (JsAst.ObjectLiteral) current;
    }
}
