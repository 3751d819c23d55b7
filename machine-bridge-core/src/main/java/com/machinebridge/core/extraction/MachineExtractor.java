package com.machinebridge.core.extraction;

import com.machinebridge.core.ast.FactoryCall;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.model.Digraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts the configuration passed to one machine factory call into a {@link Digraph}.
 *
 * <p>Extraction is best-effort: malformed or unsupported constructs are reported as soft
 * errors in the result and never abort extraction of the surrounding tree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceFile file = parser.parse("machine.ts", text);
 * ExtractionResult result = new MachineExtractor().extract(file, 0);
 * Digraph digraph = result.digraph();
 * }</pre>
 *
 * @see ReferenceResolver
 */
public class MachineExtractor {

    private static final Logger log = LoggerFactory.getLogger(MachineExtractor.class);

    /**
     * Extracts the machine at the given index of the file.
     *
     * @param sourceFile parsed file
     * @param machineIndex index into {@link SourceFile#factoryCalls()}
     * @return extraction result
     * @throws IllegalArgumentException if the file has no call at that index
     */
    public ExtractionResult extract(SourceFile sourceFile, int machineIndex) {
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        List<FactoryCall> calls = sourceFile.factoryCalls();
        if (machineIndex < 0 || machineIndex >= calls.size()) {
            throw new IllegalArgumentException("No machine at index " + machineIndex + " of "
                + sourceFile.fileName() + " (" + calls.size() + " found)");
        }
        FactoryCall call = calls.get(machineIndex);

        ExtractionContext ctx = new ExtractionContext(sourceFile, machineIndex);
        TreeNode root = new StateExtractor().extractState(ctx, call.config().orElse(null), null, StateExtractor.ROOT_KEY);
        new ReferenceResolver(root.id()).resolveAll(ctx);

        Digraph digraph = ctx.buildDigraph(root.id());
        Map<String, String> idMap = new LinkedHashMap<>();
        ctx.declaredIds.forEach((declaredId, nodeId) -> idMap.put(nodeId, declaredId));

        log.debug("Extracted machine {} of {}: {} nodes, {} edges, {} blocks, {} errors",
            machineIndex, sourceFile.fileName(), digraph.nodes().size(), digraph.edges().size(),
            digraph.blocks().size(), ctx.errors.size());
        return new ExtractionResult(digraph, ctx.errors, ctx.locators(), idMap);
    }
}
