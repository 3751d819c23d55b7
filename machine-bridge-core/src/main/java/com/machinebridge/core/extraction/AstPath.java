package com.machinebridge.core.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural locator: the steps from the configuration literal to a nested literal.
 *
 * <p>An empty path addresses the configuration literal itself.
 *
 * @param steps steps from the root
 */
public record AstPath(List<AstPathStep> steps) {

    private static final AstPath ROOT = new AstPath(List.of());

    public AstPath {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static AstPath root() {
        return ROOT;
    }

    public AstPath append(AstPathStep step) {
        List<AstPathStep> appended = new ArrayList<>(steps);
        appended.add(step);
        return new AstPath(appended);
    }

    /**
     * Returns the path without its last step.
     *
     * @throws IllegalStateException if the path is empty
     */
    public AstPath parent() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Root path has no parent");
        }
        return new AstPath(steps.subList(0, steps.size() - 1));
    }

    public AstPathStep last() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Root path has no last step");
        }
        return steps.get(steps.size() - 1);
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    @Override
    public String toString() {
        return steps.stream().map(AstPathStep::toString).collect(Collectors.joining(".", "[", "]"));
    }
}
