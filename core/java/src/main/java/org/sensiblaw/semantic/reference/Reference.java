package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.citation.CitationKind;
import org.sensiblaw.semantic.model.TextSpan;

/**
 * A raw reference mention read from a REFERENCE node, before canonicalization.
 *
 * @param kind         citation shape
 * @param work         instrument or report text as written, {@code null} for a bare provision
 * @param section      provision designator and number as written, e.g. {@code part IV}
 * @param pinpoint     sub-provision suffix such as {@code (2)(a)}
 * @param citationText full surface text of the mention
 * @param clauseId     id of the enclosing CLAUSE node
 * @param span         token span of the mention
 * @param provenance   display-only provenance
 */
public record Reference(
        CitationKind kind,
        String work,
        String section,
        String pinpoint,
        String citationText,
        String clauseId,
        TextSpan span,
        ReferenceProvenance provenance
) {
    public boolean isInternal() {
        return kind == CitationKind.PROVISION && work == null;
    }
}
