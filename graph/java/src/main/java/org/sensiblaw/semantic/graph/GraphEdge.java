package org.sensiblaw.semantic.graph;

import java.util.Comparator;

/**
 * A directed edge between two obligations.
 *
 * @param kind       edge kind
 * @param from       OBL-ID of the obligation holding the trigger
 * @param to         OBL-ID of the resolved target
 * @param text       trigger text as written: the marker for cross-document kinds, the
 *                   condition, exception or dependency phrase otherwise
 * @param provenance trigger location
 */
public record GraphEdge(EdgeKind kind, String from, String to, String text, EdgeProvenance provenance) {

    /** Serialization order: kind, then from, then to. */
    public static final Comparator<GraphEdge> ORDER = Comparator
            .comparing((GraphEdge e) -> e.kind().wireName())
            .thenComparing(GraphEdge::from)
            .thenComparing(GraphEdge::to)
            .thenComparing(GraphEdge::text)
            .thenComparing(e -> e.provenance().sourceId())
            .thenComparing(e -> e.provenance().clauseId());
}
