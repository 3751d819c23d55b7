package com.machinebridge.core.extraction;

import com.machinebridge.core.model.ExtractionErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Resolves queued transition target strings to node ids once the whole tree is extracted.
 *
 * <p><b>Target syntax:</b> the text before the first dot selects the origin, the rest is a path
 * of child keys walked from it.
 * <ul>
 *   <li>{@code ""} (leading dot, {@code .child}) - the transition's source state</li>
 *   <li>{@code #id} - the state that declares {@code id}</li>
 *   <li>anything else - a sibling of the source state</li>
 * </ul>
 * An unresolvable target is dropped with a {@code transition_target_unresolved} error; other
 * targets of the same edge are unaffected.
 */
final class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final String ID_PREFIX = "#";

    private final String rootId;

    ReferenceResolver(String rootId) {
        this.rootId = rootId;
    }

    void resolveAll(ExtractionContext ctx) {
        for (Map.Entry<String, List<String>> pending : ctx.pendingTargets.entrySet()) {
            EdgeBuilder edge = ctx.edges.get(pending.getKey());
            for (String target : pending.getValue()) {
                String resolved = resolve(ctx, edge.source, target);
                if (resolved == null) {
                    log.debug("Unresolved target '{}' on edge {}", target, edge.id);
                    ctx.error(ExtractionErrorType.TRANSITION_TARGET_UNRESOLVED, target);
                    continue;
                }
                edge.targets.add(resolved);
            }
        }
    }

    /**
     * Resolves one target string relative to a source node.
     *
     * @return target node id, or null if unresolvable
     */
    String resolve(ExtractionContext ctx, String sourceId, String target) {
        List<String> segments = Arrays.asList(target.split("\\.", -1));
        TreeNode marker = origin(ctx, sourceId, segments.get(0));
        if (marker == null) {
            return null;
        }
        for (String segment : segments.subList(1, segments.size())) {
            if (segment.isEmpty()) {
                break;
            }
            marker = marker.child(segment);
            if (marker == null) {
                return null;
            }
        }
        return marker.id();
    }

    private TreeNode origin(ExtractionContext ctx, String sourceId, String origin) {
        if (origin.isEmpty()) {
            return ctx.treeNodes.get(sourceId);
        }
        if (origin.startsWith(ID_PREFIX)) {
            String declaredId = origin.substring(ID_PREFIX.length());
            String nodeId = ctx.declaredIds.get(declaredId);
            if (nodeId == null && StateExtractor.ROOT_KEY.equals(declaredId)) {
                nodeId = rootId;
            }
            return nodeId != null ? ctx.treeNodes.get(nodeId) : null;
        }
        TreeNode source = ctx.treeNodes.get(sourceId);
        if (source.parentId() == null) {
            return null;
        }
        return ctx.treeNodes.get(source.parentId()).child(origin);
    }
}
