package com.machinebridge.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.ExtractionError;
import com.machinebridge.core.model.LineAndCharacterRange;
import com.machinebridge.core.model.TextRange;

import java.util.List;

/**
 * JSON shape printed by {@link ExtractCommand} for one machine.
 *
 * @param index machine index within the file
 * @param range offsets of the factory call
 * @param location zero-based line and character span of the call
 * @param digraph extracted digraph
 * @param errors soft extraction errors, omitted when disabled in configuration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineReport(
    int index,
    TextRange range,
    LineAndCharacterRange location,
    Digraph digraph,
    List<ExtractionError> errors
) {
}
