package com.machinebridge.core.extraction;

import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.EdgeData;
import com.machinebridge.core.model.EventTypeData;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable edge under construction. Targets are filled in by the {@link ReferenceResolver}.
 */
final class EdgeBuilder {

    final String id;
    final String source;
    final EventTypeData eventTypeData;
    final List<String> targets = new ArrayList<>();
    final List<String> actions = new ArrayList<>();
    String description;
    // extraction cannot tell reentering transitions apart yet
    boolean internal = true;

    EdgeBuilder(String id, String source, EventTypeData eventTypeData) {
        this.id = id;
        this.source = source;
        this.eventTypeData = eventTypeData;
    }

    Edge build() {
        return new Edge(id, source, targets, new EdgeData(eventTypeData, actions, null, description, internal));
    }
}
