package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.DocumentAnalysis;

import java.util.Objects;

/**
 * One analyzed document taking part in graph projection.
 */
public record CorpusDocument(String sourceId, DocumentAnalysis analysis) {

    public CorpusDocument {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(analysis, "analysis");
    }

    public static CorpusDocument of(DocumentAnalysis analysis) {
        return new CorpusDocument(analysis.docId(), analysis);
    }
}
