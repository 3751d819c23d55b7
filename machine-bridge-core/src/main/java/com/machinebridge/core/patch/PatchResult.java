package com.machinebridge.core.patch;

import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.TextEdit;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of applying a batch of patches.
 *
 * @param digraph digraph with every patch applied
 * @param edits text edits against the unmodified source, in ascending offset order
 */
public record PatchResult(Digraph digraph, List<TextEdit> edits) {

    public PatchResult {
        Objects.requireNonNull(digraph, "digraph must not be null");
        edits = edits != null ? List.copyOf(edits) : List.of();
    }
}
