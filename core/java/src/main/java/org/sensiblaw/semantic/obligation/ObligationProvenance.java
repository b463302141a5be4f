package org.sensiblaw.semantic.obligation;

import java.util.List;

/**
 * Display-only provenance. Never hashed.
 *
 * @param sourceId    document id
 * @param revId       revision id
 * @param clauseIndex zero-based clause position in the tree
 * @param clauseLabel clause numbering as printed, or {@code null}
 * @param pages       pages the clause falls on
 * @param anchorUsed  id of the MODAL node that triggered the obligation
 */
public record ObligationProvenance(
        String sourceId,
        String revId,
        int clauseIndex,
        String clauseLabel,
        List<Integer> pages,
        String anchorUsed
) {
    public ObligationProvenance {
        pages = pages != null ? List.copyOf(pages) : List.of();
    }
}
