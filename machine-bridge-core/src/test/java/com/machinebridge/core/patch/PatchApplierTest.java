package com.machinebridge.core.patch;

import com.machinebridge.core.codechange.TextEdits;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.EventTypeData;
import com.machinebridge.core.model.Node;
import com.machinebridge.core.model.NodeData;
import com.machinebridge.core.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PatchApplier}.
 */
class PatchApplierTest extends PatchTestSupport {

    private static final String TWO_STATES = """
        createMachine({
          initial: "a",
          states: {
            a: {},
            b: {},
          },
        });
        """;

    @Test
    void apply_noPatches_producesNoEdits() {
        PatchResult result = apply(TWO_STATES, digraph -> List.of());

        assertThat(result.edits()).isEmpty();
    }

    @Test
    void apply_addEdge_writesBareTarget() {
        String text = patched(TWO_STATES, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("NEXT"), List.of(node(digraph, "b").id()))));

        assertThat(text).isEqualTo("""
            createMachine({
              initial: "a",
              states: {
                a: { on: { NEXT: "b" } },
                b: {},
              },
            });
            """);
    }

    @Test
    void apply_addEdge_returnsPatchedDigraph() {
        PatchResult result = apply(TWO_STATES, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("NEXT"), List.of(node(digraph, "b").id()))));

        assertThat(result.digraph().edges()).containsKey("e1");
    }

    @Test
    void apply_addEdgeToExistingOn_appendsOnNewLine() {
        String source = """
            createMachine({
              states: {
                a: {
                  on: {
                    GO: "b",
                  },
                },
                b: {},
              },
            });
            """;

        String text = patched(source, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("BACK"), List.of(node(digraph, "a").id()))));

        assertThat(text).isEqualTo("""
            createMachine({
              states: {
                a: {
                  on: {
                    GO: "b",
                    BACK: "a",
                  },
                },
                b: {},
              },
            });
            """);
    }

    @Test
    void apply_twoEdgesSameEvent_becomeArray() {
        String source = "createMachine({ states: { a: {}, b: {}, c: {} } });";

        String text = patched(source, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("GO"), List.of(node(digraph, "b").id())),
            addEdge("e2", node(digraph, "a").id(), named("GO"), List.of(node(digraph, "c").id()))));

        assertThat(text).isEqualTo("createMachine({ states: { a: { on: { GO: [\"b\", \"c\"] } }, b: {}, c: {} } });");
    }

    @Test
    void apply_addEdgeWithDetails_writesTransitionObject() {
        String source = "createMachine({ states: { a: {}, b: {} } });";

        String text = patched(source, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("GO"), List.of(node(digraph, "b").id()), false, "Moves on")));

        assertThat(text).isEqualTo(
            "createMachine({ states: { a: { on: { GO: { target: \"b\", reenter: true, description: \"Moves on\" } } }, b: {} } });");
    }

    @Test
    void apply_addTargetlessEdge_writesUndefined() {
        String source = "createMachine({ states: { a: {} } });";

        String text = patched(source, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("PING"), List.of())));

        assertThat(text).isEqualTo("createMachine({ states: { a: { on: { PING: undefined } } } });");
    }

    @Test
    void apply_addAlwaysAndDoneEdges_useTheirProperties() {
        String source = "createMachine({ states: { a: {}, b: {} } });";

        String text = patched(source, digraph -> {
            String a = node(digraph, "a").id();
            String b = node(digraph, "b").id();
            return List.of(
                addEdge("e1", a, new EventTypeData.Always(), List.of(b)),
                addEdge("e2", a, new EventTypeData.StateDone(), List.of(b)));
        });

        assertThat(text).isEqualTo("createMachine({ states: { a: { always: \"b\", onDone: \"b\" }, b: {} } });");
    }

    @Test
    void apply_addInvocationDoneEdge_writesIntoInvoke() {
        String source = "createMachine({ states: { loading: { invoke: { src: \"fetch\" } }, done: {} } });";

        String text = patched(source, digraph -> {
            Node loading = node(digraph, "loading");
            String actor = loading.data().invoke().get(0);
            return List.of(addEdge("e1", loading.id(), new EventTypeData.InvocationDone(actor),
                List.of(node(digraph, "done").id())));
        });

        assertThat(text).isEqualTo(
            "createMachine({ states: { loading: { invoke: { src: \"fetch\", onDone: \"done\" } }, done: {} } });");
    }

    @Test
    void apply_addInvocationDoneEdge_repeatedOnDone_extendsTheOneThatIsRead() {
        String source = "createMachine({ states: { loading: { invoke: { src: \"fetch\", onDone: \"a\", onDone: \"b\" } }, "
            + "a: {}, b: {} } });";

        String text = patched(source, digraph -> {
            Node loading = node(digraph, "loading");
            assertThat(edgesFrom(digraph, "loading")).singleElement()
                .satisfies(edge -> assertThat(edge.targets()).containsExactly(node(digraph, "b").id()));
            String actor = loading.data().invoke().get(0);
            return List.of(addEdge("e1", loading.id(), new EventTypeData.InvocationDone(actor),
                List.of(node(digraph, "a").id())));
        });

        assertThat(text).contains("onDone: \"a\", onDone: [\"b\", \"a\"] }");
    }

    @Test
    void apply_addWildcardEdge_isUnsupported() {
        assertThatThrownBy(() -> apply("createMachine({ states: { a: {} } });", digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), new EventTypeData.Wildcard(), List.of()))))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void apply_addNode_insertsEmptyState() {
        String text = patched(TWO_STATES, digraph -> List.of(addNode("n1", digraph.root(), "c")));

        assertThat(text).isEqualTo("""
            createMachine({
              initial: "a",
              states: {
                a: {},
                b: {},
                c: {},
              },
            });
            """);
    }

    @Test
    void apply_addNodeWithoutStates_createsStatesObject() {
        String text = patched("createMachine({ id: \"m\" });", digraph -> List.of(addNode("n1", digraph.root(), "idle")));

        assertThat(text).isEqualTo("createMachine({ id: \"m\", states: { idle: {} } });");
    }

    @Test
    void apply_addNodeThenDetails_writesInsideNewState() {
        String source = "createMachine({ states: { a: {} } });";

        String text = patched(source, digraph -> {
            Node c = new Node("n1", digraph.root(), NodeData.empty("c"));
            return List.of(
                addNode("n1", digraph.root(), "c"),
                replaceData(c, "type", "final"),
                addEdge("e1", "n1", named("BACK"), List.of(node(digraph, "a").id())));
        });

        assertThat(text).isEqualTo("createMachine({ states: { a: {}, c: { type: \"final\", on: { BACK: \"a\" } } } });");
    }

    @Test
    void apply_addNodeThenRemoveIt_leavesSourceUntouched() {
        PatchResult result = apply(TWO_STATES, digraph -> List.of(
            addNode("n1", digraph.root(), "c"),
            Patch.remove(List.of("nodes", "n1"))));

        assertThat(result.edits()).isEmpty();
        assertThat(result.digraph().nodes()).doesNotContainKey("n1");
    }

    @Test
    void apply_addDuplicateChildKey_throws() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(addNode("n1", digraph.root(), "a"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already has a child 'a'");
    }

    @Test
    void apply_addSecondRoot_throws() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(addNode("n1", null, "other"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("second root");
    }

    @Test
    void apply_replaceKey_renamesProperty() {
        String text = patched(TWO_STATES, digraph -> List.of(replaceData(node(digraph, "b"), "key", "done")));

        assertThat(text).contains("    done: {},").doesNotContain("b: {}");
    }

    @Test
    void apply_replaceRootKey_throws() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(replaceData(digraph.rootNode(), "key", "x"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void apply_replaceInitial_goesBeforeStates() {
        String text = patched("createMachine({ id: \"m\", states: { a: {} } });",
            digraph -> List.of(replaceData(digraph.rootNode(), "initial", "a")));

        assertThat(text).isEqualTo("createMachine({ id: \"m\", initial: \"a\", states: { a: {} } });");
    }

    @Test
    void apply_replaceExistingInitial_rewritesValue() {
        String text = patched(TWO_STATES, digraph -> List.of(replaceData(digraph.rootNode(), "initial", "b")));

        assertThat(text).contains("  initial: \"b\",");
    }

    @Test
    void apply_replaceTypeWithDefault_removesProperty() {
        String text = patched("createMachine({ states: { a: { type: \"final\" } } });",
            digraph -> List.of(replaceData(node(digraph, "a"), "type", NodeType.NORMAL.code())));

        assertThat(text).isEqualTo("createMachine({ states: { a: {} } });");
    }

    @Test
    void apply_replaceType_insertsFirst() {
        String text = patched("createMachine({ states: { a: { entry: \"log\" } } });",
            digraph -> List.of(replaceData(node(digraph, "a"), "type", "final")));

        assertThat(text).isEqualTo("createMachine({ states: { a: { type: \"final\", entry: \"log\" } } });");
    }

    @Test
    void apply_removeTypeThenSetItAgain_writesLastValue() {
        String source = "createMachine({ states: { a: { type: \"parallel\", states: {} } } });";

        PatchResult result = apply(source, digraph -> List.of(
            replaceData(node(digraph, "a"), "type", NodeType.NORMAL.code()),
            replaceData(node(digraph, "a"), "type", "final")));

        assertThat(TextEdits.apply(source, result.edits()))
            .isEqualTo("createMachine({ states: { a: { type: \"final\", states: {} } } });");
        assertThat(node(result.digraph(), "a").data().type()).isEqualTo(NodeType.FINAL);
    }

    @Test
    void apply_removeTypeThenSetHistory_keepsHistory() {
        String text = patched("createMachine({ states: { a: { type: \"history\", states: {} } } });",
            digraph -> List.of(
                replaceData(node(digraph, "a"), "type", NodeType.NORMAL.code()),
                replaceData(node(digraph, "a"), "history", "deep")));

        assertThat(text).isEqualTo("createMachine({ states: { a: { history: \"deep\", states: {} } } });");
    }

    @Test
    void apply_removeEdgeThenAddSameEvent_writesNewTransition() {
        String source = "createMachine({ states: { a: { on: { GO: \"b\" } }, b: {} } });";

        String text = patched(source, digraph -> List.of(
            Patch.remove(List.of("edges", edgeFor(digraph, "a", "GO").id())),
            addEdge("e1", node(digraph, "a").id(), named("GO"), List.of(node(digraph, "b").id()), false, null)));

        assertThat(text).isEqualTo(
            "createMachine({ states: { a: { on: { GO: { target: \"b\", reenter: true } } }, b: {} } });");
    }

    @Test
    void apply_replaceHistoryWithDefault_removesProperty() {
        String text = patched("createMachine({ states: { h: { type: \"history\", history: \"deep\" } } });",
            digraph -> List.of(replaceData(node(digraph, "h"), "history", "shallow")));

        assertThat(text).isEqualTo("createMachine({ states: { h: { type: \"history\" } } });");
    }

    @Test
    void apply_replaceDescription_multilineUsesTemplate() {
        String text = patched("createMachine({ states: { a: {} } });",
            digraph -> List.of(replaceData(node(digraph, "a"), "description", "first line\nsecond line")));

        assertThat(text).isEqualTo("createMachine({ states: { a: { description: `first line\nsecond line` } } });");
    }

    @Test
    void apply_removeDescription_deletesProperty() {
        String text = patched("createMachine({ states: { a: { description: \"old\", entry: \"x\" } } });",
            digraph -> List.of(Patch.remove(List.of("nodes", node(digraph, "a").id(), "data", "description"))));

        assertThat(text).isEqualTo("createMachine({ states: { a: { entry: \"x\" } } });");
    }

    @Test
    void apply_removeNode_deletesStateProperty() {
        String text = patched(TWO_STATES, digraph -> List.of(Patch.remove(List.of("nodes", node(digraph, "b").id()))));

        assertThat(text).isEqualTo("""
            createMachine({
              initial: "a",
              states: {
                a: {},
              },
            });
            """);
    }

    @Test
    void apply_removeRootNode_throws() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(Patch.remove(List.of("nodes", digraph.root())))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void apply_removeEdge_deletesTransition() {
        String source = "createMachine({ states: { a: { on: { GO: \"b\", STAY: \"a\" } }, b: {} } });";

        String text = patched(source, digraph -> List.of(Patch.remove(List.of("edges", edgeFor(digraph, "a", "GO").id()))));

        assertThat(text).isEqualTo("createMachine({ states: { a: { on: { STAY: \"a\" } }, b: {} } });");
    }

    @Test
    void apply_removeEdgeInArray_deletesElement() {
        String source = "createMachine({ states: { a: { on: { GO: [\"b\", \"c\"] } }, b: {}, c: {} } });";

        String text = patched(source, digraph -> {
            Edge toC = edgesFrom(digraph, "a").stream()
                .filter(edge -> edge.targets().contains(node(digraph, "c").id()))
                .findFirst()
                .orElseThrow();
            return List.of(Patch.remove(List.of("edges", toC.id())));
        });

        assertThat(text).isEqualTo("createMachine({ states: { a: { on: { GO: [\"b\"] } }, b: {}, c: {} } });");
    }

    @Test
    void apply_removeEdgeAddedInSameBatch_isUnsupported() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(
            addEdge("e1", node(digraph, "a").id(), named("GO"), List.of()),
            Patch.remove(List.of("edges", "e1")))))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void apply_unmappedPatch_changesDigraphOnly() {
        PatchResult result = apply(TWO_STATES, digraph -> List.of(
            Patch.add(List.of("nodes", node(digraph, "a").id(), "data", "tags", "-"), tree("busy"))));

        assertThat(result.edits()).isEmpty();
        assertThat(node(result.digraph(), "a").data().tags()).containsExactly("busy");
    }

    @Test
    void apply_invalidPatchPath_throws() {
        assertThatThrownBy(() -> apply(TWO_STATES, digraph -> List.of(
            replaceData(new Node("missing", digraph.root(), NodeData.empty("x")), "type", "final"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Edge edgeFor(Digraph digraph, String sourcePath, String event) {
        return edgesFrom(digraph, sourcePath).stream()
            .filter(edge -> edge.data().eventTypeData().equals(named(event)))
            .findFirst()
            .orElseThrow();
    }
}
