package org.sensiblaw.semantic.graph;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable obligation graph. Nodes are sorted by OBL-ID, edges by (kind, from, to).
 * Cycles are annotated, never pruned.
 */
public final class ObligationGraph {

    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final List<List<String>> cycles;
    private final List<Diagnostic> diagnostics;
    private final Map<String, GraphNode> byId = new TreeMap<>();

    ObligationGraph(List<GraphNode> nodes, List<GraphEdge> edges, List<List<String>> cycles,
                    List<Diagnostic> diagnostics) {
        this.nodes = nodes.stream()
                .sorted(Comparator.comparing(GraphNode::oblId)).toList();
        this.edges = edges.stream().sorted(GraphEdge.ORDER).toList();
        this.cycles = cycles.stream().map(List::copyOf).toList();
        this.diagnostics = diagnostics.stream().sorted(Diagnostic.ORDER).toList();
        for (GraphNode node : this.nodes) {
            byId.put(node.oblId(), node);
        }
    }

    public List<GraphNode> nodes() { return nodes; }
    public List<GraphEdge> edges() { return edges; }
    public List<Diagnostic> diagnostics() { return diagnostics; }

    /** Strongly connected components with more than one node, or a self-loop; each sorted. */
    public List<List<String>> cycles() { return cycles; }

    public GraphNode node(String oblId) {
        GraphNode node = byId.get(oblId);
        if (node == null) throw new NoSuchElementException("No obligation " + oblId + " in graph");
        return node;
    }

    public boolean contains(String oblId) {
        return byId.containsKey(oblId);
    }

    public List<GraphEdge> edgesFrom(String oblId) {
        return edges.stream().filter(e -> e.from().equals(oblId)).toList();
    }

    public List<GraphEdge> edgesTo(String oblId) {
        return edges.stream().filter(e -> e.to().equals(oblId)).toList();
    }

    public boolean inCycle(String oblId) {
        return cycles.stream().anyMatch(c -> c.contains(oblId));
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /** OBL-IDs of obligations that carry the reference identity {@code referenceHash}, sorted. */
    public List<String> obligationsFor(String referenceHash) {
        Set<String> out = new TreeSet<>();
        for (GraphNode node : nodes) {
            if (node.referenceIdentities().contains(referenceHash)) out.add(node.oblId());
        }
        return List.copyOf(out);
    }
}
