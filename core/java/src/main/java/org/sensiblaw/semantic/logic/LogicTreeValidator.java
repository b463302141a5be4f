package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.model.SpanOutOfBoundsException;
import org.sensiblaw.semantic.model.TextSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structural invariants of a {@link LogicTree}: spans inside the token stream,
 * one STRUCTURAL parent per non-root node, children contained in and non-overlapping
 * within their parent, sibling order matching source order, ids matching spans.
 */
public class LogicTreeValidator {

    /**
     * Immutable result of validating a tree.
     *
     * @param errors   broken invariants
     * @param warnings permitted but suspicious shapes
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(LogicTree tree) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        LogicNode root = tree.root();
        if (root.type() != NodeType.ROOT) {
            errors.add("root '" + root.id() + "': expected ROOT, got " + root.type());
        }
        if (root.span().start() != 0 || root.span().end() != tree.stream().size()) {
            errors.add("root: span " + root.span() + " does not cover the token stream");
        }

        Set<String> seen = new HashSet<>();
        Map<String, Integer> parentCount = new HashMap<>();
        for (LogicEdge edge : tree.edges()) {
            if (!tree.contains(edge.sourceId()) || !tree.contains(edge.targetId())) {
                errors.add("edge " + edge.type() + " " + edge.sourceId() + " -> " + edge.targetId() + ": dangling endpoint");
                continue;
            }
            if (edge.type() == EdgeType.STRUCTURAL) parentCount.merge(edge.targetId(), 1, Integer::sum);
        }

        for (LogicNode node : tree.nodes()) {
            String p = node.type() + " '" + node.id() + "'";
            if (!seen.add(node.id())) {
                errors.add(p + ": duplicate id");
            }
            try {
                tree.stream().checkSpan(node.span());
            } catch (SpanOutOfBoundsException e) {
                errors.add(p + ": " + e.getMessage());
                continue;
            }
            String expected = LogicTreeBuilder.nodeId(tree.docId(), tree.revId(), node.type(),
                    node.span().start(), node.span().end());
            if (!expected.equals(node.id())) {
                errors.add(p + ": id does not derive from its type and span");
            }
            int parents = parentCount.getOrDefault(node.id(), 0);
            if (node.type() == NodeType.ROOT) {
                if (parents != 0) errors.add(p + ": ROOT must not have a parent");
            } else if (parents != 1) {
                errors.add(p + ": expected exactly one STRUCTURAL parent, found " + parents);
            }
            if (!node.type().isContainer() && !node.isLeaf()) {
                errors.add(p + ": " + node.type() + " nodes cannot have children");
            }
            if (node.type() == NodeType.CLAUSE && node.span().isEmpty()) {
                warnings.add(p + ": empty clause");
            }
            checkChildren(tree, node, errors);
        }
        return new ValidationResult(errors, warnings);
    }

    private static void checkChildren(LogicTree tree, LogicNode parent, List<String> errors) {
        TextSpan previous = null;
        for (String childId : parent.children()) {
            if (!tree.contains(childId)) {
                errors.add(parent.type() + " '" + parent.id() + "': unknown child '" + childId + "'");
                continue;
            }
            TextSpan span = tree.node(childId).span();
            if (!parent.span().contains(span)) {
                errors.add("node '" + childId + "': span " + span + " escapes parent " + parent.span());
            }
            if (previous != null && span.start() < previous.end()) {
                errors.add("node '" + childId + "': span " + span + " overlaps or precedes sibling " + previous);
            }
            previous = span;
        }
    }
}
