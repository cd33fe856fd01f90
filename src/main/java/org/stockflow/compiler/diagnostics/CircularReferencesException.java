package org.stockflow.compiler.diagnostics;

import java.util.List;
import java.util.Map;

/**
 * Thrown when the initial values of stocks reference each other in a cycle.
 */
public class CircularReferencesException extends IllegalModelException {

    private final Map<String, List<String>> cycle;
    private final Map<String, List<String>> graph;

    /**
     * @param cycle The edges left over after all acyclic stocks were peeled away.
     * @param graph The full reference graph, stock name to referenced stock names.
     */
    public CircularReferencesException(Map<String, List<String>> cycle, Map<String, List<String>> graph) {
        super("found cycle '" + cycle + "' in references '" + graph + "'");
        this.cycle = Map.copyOf(cycle);
        this.graph = Map.copyOf(graph);
    }

    public Map<String, List<String>> getCycle() {
        return cycle;
    }

    public Map<String, List<String>> getGraph() {
        return graph;
    }
}
