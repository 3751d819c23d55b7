package com.machinebridge.core.model;

import java.util.List;

/**
 * Result of extracting one machine: the best-effort digraph and every soft error encountered.
 * A call without a configuration object yields a digraph holding only an empty root.
 *
 * @param digraph extracted digraph, never null
 * @param errors soft errors in encounter order
 */
public record MachineExtraction(Digraph digraph, List<ExtractionError> errors) {

    public MachineExtraction {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
