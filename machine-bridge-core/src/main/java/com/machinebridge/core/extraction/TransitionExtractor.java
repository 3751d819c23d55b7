package com.machinebridge.core.extraction;

import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.ActionBlock;
import com.machinebridge.core.model.EventTypeData;
import com.machinebridge.core.model.ExtractionErrorType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts transition groups into edges.
 *
 * <p>A group is a single transition or an array of them. Each transition is a target string,
 * {@code undefined}/{@code null} (targetless) or an object with {@code target}, {@code actions}
 * and {@code description}. If any transition of a group cannot be read, the group produces no
 * edges and a {@code transition_property_unhandled} error.
 *
 * <p>Target strings are not resolved here; they are queued on the context for the
 * {@link ReferenceResolver}.
 */
final class TransitionExtractor {

    static final String ON_DONE = "onDone";
    static final String ON_ERROR = "onError";

    private static final String TARGET = "target";
    private static final String ACTIONS = "actions";
    private static final String DESCRIPTION = "description";

    private final BlockExtractor blockExtractor;

    TransitionExtractor(BlockExtractor blockExtractor) {
        this.blockExtractor = blockExtractor;
    }

    private record Transition(EdgeBuilder edge, AstPath locator, List<String> targets, List<ActionBlock> actions) {
    }

    /**
     * Extracts one transition group and registers its edges.
     *
     * @param ctx extraction context, positioned at the group's property
     * @param value group value
     * @param sourceId source node id
     * @param eventTypeData trigger shared by every transition of the group
     */
    void extractGroup(ExtractionContext ctx, JsAst.Expression value, String sourceId, EventTypeData eventTypeData) {
        List<Transition> transitions = Literals.mapMaybeArray(ctx, value,
            (element, index) -> extractTransition(ctx, element, sourceId, eventTypeData));
        if (!Literals.allPresent(transitions)) {
            ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
            return;
        }
        for (Transition transition : transitions) {
            ctx.addEdge(transition.edge(), transition.locator(), transition.targets());
            for (ActionBlock action : transition.actions()) {
                ctx.registerAction(action, transition.edge().actions);
            }
        }
    }

    /**
     * Extracts {@code onDone}/{@code onError} of an invoke object literal.
     *
     * @param ctx extraction context, positioned at the invoke element
     * @param invoke invoke object literal
     * @param sourceId owning node id
     * @param actorBlockId actor block the transitions belong to
     */
    void extractInvokeTransitions(ExtractionContext ctx, JsAst.ObjectLiteral invoke, String sourceId, String actorBlockId) {
        extractNamedGroup(ctx, invoke, ON_DONE, sourceId, new EventTypeData.InvocationDone(actorBlockId));
        extractNamedGroup(ctx, invoke, ON_ERROR, sourceId, new EventTypeData.InvocationError(actorBlockId));
    }

    private void extractNamedGroup(ExtractionContext ctx, JsAst.ObjectLiteral object, String key,
                                   String sourceId, EventTypeData eventTypeData) {
        List<JsAst.Member> members = object.members();
        for (int i = members.size() - 1; i >= 0; i--) {
            if (members.get(i) instanceof JsAst.PropertyAssignment property
                && PropertyKeys.staticKey(property.name()).filter(key::equals).isPresent()) {
                ctx.inStep(AstPathStep.property(i), () -> extractGroup(ctx, property.value(), sourceId, eventTypeData));
                return;
            }
        }
    }

    private Transition extractTransition(ExtractionContext ctx, JsAst.Expression element,
                                         String sourceId, EventTypeData eventTypeData) {
        EdgeBuilder edge = new EdgeBuilder(ctx.newId("edge"), sourceId, eventTypeData);
        AstPath locator = ctx.currentPath();

        if (Literals.isNoTarget(element)) {
            return new Transition(edge, locator, null, List.of());
        }
        if (element instanceof JsAst.StringLike string) {
            return new Transition(edge, locator, List.of(string.value()), List.of());
        }
        if (!(element instanceof JsAst.ObjectLiteral object)) {
            return null;
        }

        List<String> targets = objectTargets(object);
        if (targets != null && !Literals.allPresent(targets)) {
            return null;
        }

        List<ActionBlock> actions = List.of();
        Set<String> seen = new HashSet<>();
        List<JsAst.Member> members = object.members();
        for (int i = members.size() - 1; i >= 0; i--) {
            if (!(members.get(i) instanceof JsAst.PropertyAssignment property)) {
                ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
                continue;
            }
            Optional<String> key = PropertyKeys.key(ctx, property.name());
            if (key.isEmpty()) {
                ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
                continue;
            }
            if (!seen.add(key.get())) {
                continue;
            }
            switch (key.get()) {
                case ACTIONS -> {
                    Optional<List<ActionBlock>> blocks = ctx.withStep(AstPathStep.property(i),
                        () -> blockExtractor.extractActions(ctx, property.value(), edge.id));
                    if (blocks.isEmpty()) {
                        ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
                    } else {
                        actions = blocks.get();
                    }
                }
                case DESCRIPTION -> edge.description = property.value() instanceof JsAst.StringLike string
                    ? string.value()
                    : null;
                default -> {
                    // target is read above; guard and reenter are not extracted
                }
            }
        }
        return new Transition(edge, locator, targets, actions);
    }

    /**
     * Returns the target strings of a transition object; null entries mark non-string targets,
     * a null result means targetless.
     */
    private static List<String> objectTargets(JsAst.ObjectLiteral object) {
        Optional<JsAst.PropertyAssignment> target = PropertyKeys.findLast(object, TARGET);
        if (target.isEmpty() || Literals.isNoTarget(target.get().value())) {
            return null;
        }
        JsAst.Expression value = target.get().value();
        List<JsAst.Expression> elements = value instanceof JsAst.ArrayLiteral array ? array.elements() : List.of(value);
        List<String> targets = new ArrayList<>();
        for (JsAst.Expression element : elements) {
            targets.add(element instanceof JsAst.StringLike string ? string.value() : null);
        }
        return targets;
    }
}
