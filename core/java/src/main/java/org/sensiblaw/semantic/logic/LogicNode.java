package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.model.TextSpan;

import java.util.List;

/**
 * One node of a {@link LogicTree}.
 *
 * @param id       deterministic id derived from document, revision, type and span
 * @param type     node type
 * @param span     token span; children spans lie inside it
 * @param text     surface text of the span
 * @param label    type-specific tag: modality type for MODAL, condition type for CONDITION and
 *                 EXCEPTION, citation kind for REFERENCE, numbering label for CLAUSE; may be null
 * @param children child ids in source order
 */
public record LogicNode(
        String id,
        NodeType type,
        TextSpan span,
        String text,
        String label,
        List<String> children
) {
    public LogicNode {
        children = children != null ? List.copyOf(children) : List.of();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
