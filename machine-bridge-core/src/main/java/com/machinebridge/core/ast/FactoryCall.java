package com.machinebridge.core.ast;

import com.machinebridge.core.model.TextRange;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A located machine factory call such as {@code createMachine({...})} or
 * {@code xstate.createMachine({...})}.
 *
 * @param range range of the whole call expression, callee included
 * @param calleeName factory function name
 * @param arguments call arguments in order
 */
public record FactoryCall(TextRange range, String calleeName, List<JsAst.Expression> arguments) {

    /**
     * Compact constructor with validation.
     */
    public FactoryCall {
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(calleeName, "calleeName must not be null");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    /**
     * Returns the configuration argument, if the call has one.
     *
     * @return first argument
     */
    public Optional<JsAst.Expression> config() {
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments.get(0));
    }
}
