package org.sensiblaw.semantic.reference;

import java.util.List;

/**
 * Where a reference was read from. Carried for debugging and display only; it never
 * feeds an identity hash or a diff.
 *
 * @param clauseId   id of the CLAUSE node holding the reference
 * @param pages      pages the reference span falls on, empty without a page map
 * @param source     {@code docId@revId} of the source revision
 * @param anchorUsed id of the REFERENCE node the mention was read from
 */
public record ReferenceProvenance(String clauseId, List<Integer> pages, String source, String anchorUsed) {
    public ReferenceProvenance {
        pages = pages != null ? List.copyOf(pages) : List.of();
    }
}
