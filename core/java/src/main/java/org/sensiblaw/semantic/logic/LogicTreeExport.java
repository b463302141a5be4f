package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.json.CanonicalJson;
import org.sensiblaw.semantic.model.TextSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code logic-tree-v1} JSON and Graphviz DOT renderings. Both are order-stable: nodes in
 * preorder, children by span start.
 */
public final class LogicTreeExport {

    private LogicTreeExport() {}

    // ── JSON ─────────────────────────────────────────────────────────────────

    public static Map<String, Object> toPayload(LogicTree tree) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", LogicTree.VERSION);
        payload.put("doc_id", tree.docId());
        payload.put("rev_id", tree.revId());
        payload.put("root_id", tree.rootId());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (LogicNode node : tree.nodes()) {
            Map<String, Object> n = new LinkedHashMap<>();
            n.put("id", node.id());
            n.put("type", node.type().name());
            n.put("span", span(node.span()));
            n.put("text", node.text());
            n.put("label", node.label());
            n.put("children", node.children());
            nodes.add(n);
        }
        payload.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        for (LogicEdge edge : tree.edges()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("type", edge.type().name());
            e.put("source", edge.sourceId());
            e.put("target", edge.targetId());
            edges.add(e);
        }
        payload.put("edges", edges);
        return payload;
    }

    public static String toJson(LogicTree tree) {
        return CanonicalJson.write(toPayload(tree));
    }

    public static Map<String, Object> span(TextSpan span) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("doc_id", span.docId());
        s.put("rev_id", span.revId());
        s.put("start", span.start());
        s.put("end", span.end());
        s.put("source", span.source().wireName());
        return s;
    }

    // ── DOT ──────────────────────────────────────────────────────────────────

    public static String toDot(LogicTree tree) {
        return toDot(tree, false, false);
    }

    /**
     * @param includeTokens        render TOKEN nodes when the tree holds them
     * @param includeSequenceEdges render SEQUENCE edges as dashed arrows
     */
    public static String toDot(LogicTree tree, boolean includeTokens, boolean includeSequenceEdges) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(tree.docId() + "@" + tree.revId())).append("\" {\n");
        sb.append("  node [shape=box, style=filled];\n");
        for (LogicNode node : tree.nodes()) {
            if (node.type() == NodeType.TOKEN && !includeTokens) continue;
            sb.append("  \"").append(node.id()).append("\" [label=\"")
                    .append(dotLabel(node)).append("\", fillcolor=")
                    .append(node.type().dotColor()).append("];\n");
        }
        for (LogicEdge edge : tree.edges()) {
            boolean token = tree.node(edge.targetId()).type() == NodeType.TOKEN
                    || tree.node(edge.sourceId()).type() == NodeType.TOKEN;
            if (token && !includeTokens) continue;
            if (edge.type() == EdgeType.SEQUENCE) {
                if (!includeSequenceEdges) continue;
                sb.append("  \"").append(edge.sourceId()).append("\" -> \"").append(edge.targetId())
                        .append("\" [style=dashed, constraint=false];\n");
            } else {
                sb.append("  \"").append(edge.sourceId()).append("\" -> \"").append(edge.targetId()).append("\";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String dotLabel(LogicNode node) {
        String text = node.text();
        if (text.codePointCount(0, text.length()) > 48) {
            text = text.substring(0, text.offsetByCodePoints(0, 45)) + "...";
        }
        String head = node.label() != null ? node.type() + " (" + node.label() + ")" : node.type().name();
        return node.type() == NodeType.ROOT ? escape(head) : escape(head) + "\\n" + escape(text);
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
