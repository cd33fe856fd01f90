package org.stockflow.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects cycles among the references in stock initial values and derives an order in which
 * the referencing stocks can be initialized.
 *
 * <p>The resolver repeatedly peels away every node that nothing points at any more but that
 * still points at something, removing its edges from the graph. When no node can be peeled,
 * any edges left over form at least one cycle. Self-references are cycles.</p>
 *
 * <p>The resolver works on its own copies of the edge maps; callers' maps are not modified.</p>
 */
public final class DependencyResolver {

    /**
     * Result of a resolution.
     *
     * @param hasCycle            Whether edges remained after peeling.
     * @param residual            Every node with the outward edges that could not be peeled.
     *                            All lists are empty if there is no cycle.
     * @param initializationOrder Nodes that reference others, ordered so that each one comes
     *                            after the nodes it references. Nodes without outward edges
     *                            are not included.
     */
    public record Resolution(boolean hasCycle, Map<String, List<String>> residual, List<String> initializationOrder) {

        public Resolution {
            Map<String, List<String>> frozen = new LinkedHashMap<>();
            residual.forEach((node, edges) -> frozen.put(node, List.copyOf(edges)));
            residual = Collections.unmodifiableMap(frozen);
            initializationOrder = List.copyOf(initializationOrder);
        }
    }

    private DependencyResolver() {
    }

    /**
     * Builds the inward edge map from an outward one and resolves the graph.
     *
     * @param outward Node to the nodes it references. Every node must be a key.
     */
    public static Resolution resolve(Map<String, List<String>> outward) {
        Map<String, List<String>> inward = new LinkedHashMap<>();
        for (String node : outward.keySet()) {
            inward.put(node, new ArrayList<>());
        }
        for (Map.Entry<String, List<String>> entry : outward.entrySet()) {
            for (String target : entry.getValue()) {
                inward.computeIfAbsent(target, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        return resolve(inward, outward);
    }

    /**
     * Resolves a graph given both directions of its edges.
     *
     * @param inward  Node to the nodes that reference it.
     * @param outward Node to the nodes it references.
     */
    public static Resolution resolve(Map<String, List<String>> inward, Map<String, List<String>> outward) {
        Map<String, List<String>> incoming = copy(inward);
        Map<String, List<String>> remaining = copy(outward);
        List<String> peeled = new ArrayList<>();

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Map.Entry<String, List<String>> entry : remaining.entrySet()) {
                String node = entry.getKey();
                List<String> edges = entry.getValue();
                if (incoming.getOrDefault(node, List.of()).isEmpty() && !edges.isEmpty()) {
                    for (String target : edges) {
                        List<String> targetIncoming = incoming.get(target);
                        if (targetIncoming != null) {
                            targetIncoming.remove(node);
                        }
                    }
                    edges.clear();
                    peeled.add(node);
                    changed = true;
                }
            }
        }

        boolean hasCycle = remaining.values().stream().anyMatch(edges -> !edges.isEmpty());
        Collections.reverse(peeled);
        return new Resolution(hasCycle, remaining, peeled);
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> graph) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        graph.forEach((node, edges) -> copy.put(node, new ArrayList<>(edges)));
        return copy;
    }
}
