package org.sensiblaw.semantic.graph;

import java.util.Comparator;

/**
 * Why an edge was not emitted. Diagnostics are data; projection never throws for them.
 */
public record Diagnostic(ReasonCode code, String sourceId, String clauseId, String detail) {

    public Diagnostic {
        detail = detail != null ? detail : "";
    }

    public enum ReasonCode {
        /** A marker matched but the clause holds no reference. */
        NO_REFERENCE_IN_CLAUSE,
        /** A trigger holds a reference that resolves to no known obligation. */
        UNRESOLVED_REFERENCE,
        /** The clause carries a word that must never produce an edge. */
        FORBIDDEN_MARKER;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing((Diagnostic d) -> d.sourceId())
            .thenComparing(Diagnostic::clauseId)
            .thenComparing(Diagnostic::code)
            .thenComparing(Diagnostic::detail);
}
