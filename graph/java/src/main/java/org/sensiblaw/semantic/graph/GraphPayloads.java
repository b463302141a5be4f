package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.json.CanonicalJson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code obligation.crossdoc.v2} payload. */
public final class GraphPayloads {

    public static final String VERSION = "obligation.crossdoc.v2";

    private GraphPayloads() {}

    public static Map<String, Object> toPayload(ObligationGraph graph) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", VERSION);
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            Map<String, Object> n = new LinkedHashMap<>();
            n.put("obl_id", node.oblId());
            n.put("source_id", node.sourceId());
            n.put("clause_id", node.clauseId());
            nodes.add(n);
        }
        payload.put("nodes", nodes);
        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("kind", edge.kind().wireName());
            e.put("from", edge.from());
            e.put("to", edge.to());
            e.put("text", edge.text());
            Map<String, Object> provenance = new LinkedHashMap<>();
            provenance.put("source_id", edge.provenance().sourceId());
            provenance.put("clause_id", edge.provenance().clauseId());
            provenance.put("reference_id", edge.provenance().referenceId());
            e.put("provenance", provenance);
            edges.add(e);
        }
        payload.put("edges", edges);
        payload.put("cycles", graph.cycles());
        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : graph.diagnostics()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("code", diagnostic.code().wireName());
            d.put("source_id", diagnostic.sourceId());
            d.put("clause_id", diagnostic.clauseId());
            d.put("detail", diagnostic.detail());
            diagnostics.add(d);
        }
        payload.put("diagnostics", diagnostics);
        return payload;
    }

    public static String toJson(ObligationGraph graph) {
        return CanonicalJson.write(toPayload(graph));
    }
}
