package com.machinebridge.core.extraction;

import com.machinebridge.core.MachineTestBase;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstPath} and {@link AstPaths}.
 */
class AstPathsTest extends MachineTestBase {

    private static final String TEXT = "createMachine({ states: { a: { on: { GO: [\"b\", { target: \"c\" }] } } } });";

    @Test
    void resolve_followsPropertyAndElementSteps() {
        SourceFile file = parse(TEXT);
        JsAst.Expression config = file.factoryCalls().get(0).config().orElseThrow();
        AstPath path = new AstPath(List.of(
            AstPathStep.property(0), AstPathStep.property(0), AstPathStep.property(0),
            AstPathStep.property(0), AstPathStep.element(1)));

        assertThat(AstPaths.resolve(config, path))
            .get()
            .extracting(expression -> file.textOf(expression.range()))
            .isEqualTo("{ target: \"c\" }");
    }

    @Test
    void resolve_shapeMismatch_isEmpty() {
        JsAst.Expression config = parse(TEXT).factoryCalls().get(0).config().orElseThrow();

        assertThat(AstPaths.resolve(config, AstPath.root().append(AstPathStep.property(3)))).isEmpty();
        assertThat(AstPaths.resolve(config, AstPath.root().append(AstPathStep.element(0)))).isEmpty();
    }

    @Test
    void resolveProperty_returnsAssignment() {
        JsAst.Expression config = parse(TEXT).factoryCalls().get(0).config().orElseThrow();
        AstPath path = AstPath.root().append(AstPathStep.property(0)).append(AstPathStep.property(0));

        assertThat(AstPaths.resolveProperty(config, path))
            .get()
            .extracting(property -> PropertyKeys.staticKey(property.name()).orElseThrow())
            .isEqualTo("a");
        assertThat(AstPaths.resolveProperty(config, AstPath.root())).isEmpty();
    }

    @Test
    void path_navigation() {
        AstPath path = AstPath.root().append(AstPathStep.property(2)).append(AstPathStep.element(0));

        assertThat(path.isRoot()).isFalse();
        assertThat(path.last()).isEqualTo(AstPathStep.element(0));
        assertThat(path.parent()).isEqualTo(AstPath.root().append(AstPathStep.property(2)));
        assertThat(path.toString()).isEqualTo("[p2.e0]");
        assertThatThrownBy(() -> AstPath.root().parent()).isInstanceOf(IllegalStateException.class);
    }
}
