package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.model.TextSpan;
import org.sensiblaw.semantic.model.TokenStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Immutable, span-anchored parse of one document revision. Nodes are held in preorder;
 * children of every node are ordered by span start.
 */
public final class LogicTree {

    public static final String VERSION = "logic-tree-v1";

    private final TokenStream stream;
    private final String rootId;
    private final List<LogicNode> nodes;
    private final List<LogicEdge> edges;
    private final Map<String, LogicNode> byId;
    private final Map<String, String> parents;

    LogicTree(TokenStream stream, String rootId, List<LogicNode> nodes, List<LogicEdge> edges) {
        this.stream = stream;
        this.rootId = rootId;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        Map<String, LogicNode> index = new LinkedHashMap<>();
        Map<String, String> parentIndex = new HashMap<>();
        for (LogicNode node : nodes) {
            index.put(node.id(), node);
        }
        for (LogicEdge edge : edges) {
            if (edge.type() == EdgeType.STRUCTURAL) parentIndex.put(edge.targetId(), edge.sourceId());
        }
        this.byId = index;
        this.parents = parentIndex;
    }

    public String version() { return VERSION; }
    public String docId() { return stream.docId(); }
    public String revId() { return stream.revId(); }
    public TokenStream stream() { return stream; }
    public String rootId() { return rootId; }
    public List<LogicNode> nodes() { return nodes; }
    public List<LogicEdge> edges() { return edges; }

    public LogicNode root() {
        return node(rootId);
    }

    public LogicNode node(String id) {
        LogicNode node = byId.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node '" + id + "' in " + docId() + "@" + revId());
        }
        return node;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public List<LogicNode> children(LogicNode node) {
        return node.children().stream().map(this::node).toList();
    }

    public Optional<LogicNode> parentOf(String id) {
        return Optional.ofNullable(parents.get(id)).map(this::node);
    }

    public List<LogicNode> clauses() {
        return children(root());
    }

    public List<LogicNode> nodesOfType(NodeType type) {
        return nodes.stream().filter(n -> n.type() == type).toList();
    }

    /** Descendants of {@code node} with the given type, in preorder. */
    public List<LogicNode> descendants(LogicNode node, NodeType type) {
        List<LogicNode> out = new ArrayList<>();
        Deque<LogicNode> stack = new ArrayDeque<>();
        pushChildren(stack, node);
        while (!stack.isEmpty()) {
            LogicNode current = stack.pop();
            if (current.type() == type) out.add(current);
            pushChildren(stack, current);
        }
        return out;
    }

    /** The CLAUSE whose span contains {@code span}, if any. */
    public Optional<LogicNode> containingClause(TextSpan span) {
        return clauses().stream().filter(c -> c.span().contains(span)).findFirst();
    }

    /** Zero-based position of {@code clause} among the root's clauses. */
    public int clauseIndex(LogicNode clause) {
        return root().children().indexOf(clause.id());
    }

    // ── Traversals ───────────────────────────────────────────────────────────

    public List<LogicNode> preorder() {
        return nodes;
    }

    public List<LogicNode> postorder() {
        List<LogicNode> out = new ArrayList<>(nodes.size());
        postorder(root(), out);
        return out;
    }

    private void postorder(LogicNode node, List<LogicNode> out) {
        for (LogicNode child : children(node)) {
            postorder(child, out);
        }
        out.add(node);
    }

    /** Every path of node ids from the root to a leaf, in preorder of the leaves. */
    public List<List<String>> rootToLeafPaths() {
        List<List<String>> paths = new ArrayList<>();
        collectPaths(root(), new ArrayList<>(), paths);
        return paths;
    }

    private void collectPaths(LogicNode node, List<String> prefix, List<List<String>> paths) {
        prefix.add(node.id());
        if (node.isLeaf()) {
            paths.add(List.copyOf(prefix));
        } else {
            for (LogicNode child : children(node)) {
                collectPaths(child, prefix, paths);
            }
        }
        prefix.remove(prefix.size() - 1);
    }

    private void pushChildren(Deque<LogicNode> stack, LogicNode node) {
        List<String> ids = node.children();
        for (int i = ids.size() - 1; i >= 0; i--) {
            stack.push(node(ids.get(i)));
        }
    }
}
