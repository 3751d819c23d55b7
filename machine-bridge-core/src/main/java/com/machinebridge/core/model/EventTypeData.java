package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * What triggers a transition. Serialized with a {@code type} discriminator.
 *
 * <p>The variant also determines where a transition lives in the configuration:
 * {@code on.<event>}, {@code always}, {@code onDone} or {@code invoke[i].onDone/onError}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EventTypeData.Named.class, name = "named"),
    @JsonSubTypes.Type(value = EventTypeData.Wildcard.class, name = "wildcard"),
    @JsonSubTypes.Type(value = EventTypeData.Always.class, name = "always"),
    @JsonSubTypes.Type(value = EventTypeData.StateDone.class, name = "state.done"),
    @JsonSubTypes.Type(value = EventTypeData.InvocationDone.class, name = "invocation.done"),
    @JsonSubTypes.Type(value = EventTypeData.InvocationError.class, name = "invocation.error"),
    @JsonSubTypes.Type(value = EventTypeData.After.class, name = "after"),
    @JsonSubTypes.Type(value = EventTypeData.Init.class, name = "init")
})
public interface EventTypeData {

    /**
     * Transition on a named event, {@code on: { EVENT: ... }}.
     */
    @JsonTypeName("named")
    record Named(String eventType) implements EventTypeData {
        public Named {
            Objects.requireNonNull(eventType, "eventType must not be null");
        }
    }

    /**
     * Transition on any event, {@code on: { '*': ... }}.
     */
    @JsonTypeName("wildcard")
    record Wildcard() implements EventTypeData {
    }

    /**
     * Eventless transition.
     */
    @JsonTypeName("always")
    record Always() implements EventTypeData {
    }

    /**
     * Transition taken when the state reaches a final child.
     */
    @JsonTypeName("state.done")
    record StateDone() implements EventTypeData {
    }

    /**
     * Transition taken when an invoked actor completes.
     *
     * @param invocationId actor block id
     */
    @JsonTypeName("invocation.done")
    record InvocationDone(String invocationId) implements EventTypeData {
        public InvocationDone {
            Objects.requireNonNull(invocationId, "invocationId must not be null");
        }
    }

    /**
     * Transition taken when an invoked actor fails.
     *
     * @param invocationId actor block id
     */
    @JsonTypeName("invocation.error")
    record InvocationError(String invocationId) implements EventTypeData {
        public InvocationError {
            Objects.requireNonNull(invocationId, "invocationId must not be null");
        }
    }

    /**
     * Delayed transition. Never produced by extraction.
     */
    @JsonTypeName("after")
    record After(String delay) implements EventTypeData {
    }

    /**
     * Initial transition. Never produced by extraction.
     */
    @JsonTypeName("init")
    record Init() implements EventTypeData {
    }
}
