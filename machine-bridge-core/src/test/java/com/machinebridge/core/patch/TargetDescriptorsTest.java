package com.machinebridge.core.patch;

import com.machinebridge.core.extraction.ExtractionResult;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TargetDescriptors}.
 */
class TargetDescriptorsTest extends PatchTestSupport {

    private static final String NESTED = module("""
        {
          id: "app",
          states: {
            a: { states: { a1: {}, a2: { states: { deep: {} } } } },
            b: { id: "bee", states: { b1: {} } },
            c: {},
          },
        }""");

    private Digraph digraph;
    private Map<String, String> idMap;

    @BeforeEach
    void setUp() {
        ExtractionResult result = extract(NESTED);
        digraph = result.digraph();
        idMap = result.idMap();
    }

    @ParameterizedTest
    @CsvSource({
        "a, '', #app",
        "a, a, a",
        "a, a.a2.deep, .a2.deep",
        "a, c, c",
        "a, b.b1, b.b1",
        "a.a1, b.b1, #bee.b1",
        "a.a1, a.a2, a2",
        "a.a1, c, #app.c",
        "a.a2.deep, a.a1, #app.a.a1",
        "'', b, .b",
        "b.b1, b, #bee",
        "a.a2.deep, a.a2, #app.a.a2"
    })
    void bestTargetDescriptor_followsRules(String source, String target, String expected) {
        String descriptor = TargetDescriptors.bestTargetDescriptor(digraph, idMap,
            node(digraph, source).id(), node(digraph, target).id());

        assertThat(descriptor).isEqualTo(expected);
    }

    @Test
    void bestTargetDescriptor_undeclaredRoot_usesDefaultId() {
        ExtractionResult result = extract(module("{ states: { a: { states: { a1: {} } }, b: {} } }"));
        Digraph plain = result.digraph();

        assertThat(TargetDescriptors.bestTargetDescriptor(plain, result.idMap(),
            node(plain, "a").id(), plain.root())).isEqualTo("#(machine)");
        assertThat(TargetDescriptors.bestTargetDescriptor(plain, result.idMap(),
            node(plain, "a.a1").id(), node(plain, "b").id())).isEqualTo("#(machine).b");
    }

    @Test
    void bestTargetDescriptor_unknownNode_throws() {
        assertThatThrownBy(() -> TargetDescriptors.bestTargetDescriptor(digraph, idMap, digraph.root(), "missing"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void bestTargetDescriptor_everyPair_resolvesBackToTarget() {
        List<String> paths = List.of("", "a", "a.a1", "a.a2", "a.a2.deep", "b", "b.b1", "c");
        List<String> failures = new ArrayList<>();

        for (String sourcePath : paths) {
            for (String targetPath : paths) {
                String written = patched(NESTED, graph -> List.of(addEdge("probe", node(graph, sourcePath).id(),
                    named("PROBE"), List.of(node(graph, targetPath).id()))));
                Digraph reread = extract(written).digraph();
                String expectedTarget = node(reread, targetPath).id();
                List<String> targets = edgesFrom(reread, sourcePath).stream()
                    .filter(edge -> edge.data().eventTypeData().equals(named("PROBE")))
                    .map(Edge::targets)
                    .findFirst()
                    .orElse(List.of());
                if (!targets.equals(List.of(expectedTarget))) {
                    failures.add("'" + sourcePath + "' -> '" + targetPath + "'");
                }
            }
        }

        assertThat(failures).isEmpty();
    }

    @Test
    void bestTargetDescriptor_targetAddedInSameBatch_isResolvable() {
        String written = patched(NESTED, graph -> {
            Node c = node(graph, "c");
            return List.of(
                addNode("n1", c.id(), "inner"),
                addEdge("e1", node(graph, "a.a1").id(), named("JUMP"), List.of("n1")));
        });

        Digraph reread = extract(written).digraph();
        Edge jump = edgesFrom(reread, "a.a1").get(0);
        assertThat(jump.targets()).containsExactly(node(reread, "c.inner").id());
    }
}
