package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.reference.ReferenceCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Projects analyzed documents into one {@link ObligationGraph}.
 *
 * <p>Nodes are the distinct OBL-IDs of the corpus; an OBL-ID seen in several documents
 * keeps the first document by source id. Edges come only from explicit in-clause
 * triggers; duplicate edges collapse. Unresolved triggers are reported as diagnostics.
 */
public class ObligationGraphProjector {

    private static final Logger log = LoggerFactory.getLogger(ObligationGraphProjector.class);

    private final LegalLexicon lexicon;

    public ObligationGraphProjector() {
        this(LegalLexicon.defaults());
    }

    public ObligationGraphProjector(LegalLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public ObligationGraph project(List<CorpusDocument> documents) {
        List<CorpusDocument> corpus = documents.stream()
                .sorted(Comparator.comparing(CorpusDocument::sourceId)).toList();
        ReferenceResolver resolver = new ReferenceResolver(corpus, new ReferenceCanonicalizer(lexicon));
        IntraDocumentProjector intra = new IntraDocumentProjector(lexicon, resolver);
        CrossDocumentProjector cross = new CrossDocumentProjector(resolver);

        Map<String, GraphNode> nodes = new TreeMap<>();
        List<GraphEdge> edges = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CorpusDocument document : corpus) {
            for (ObligationIdentity obligation : document.analysis().obligations()) {
                nodes.putIfAbsent(obligation.identityHash(), new GraphNode(obligation.identityHash(),
                        document.sourceId(), obligation.clauseId(), obligation.referenceIdentities()));
            }
            intra.project(document, edges, diagnostics);
            cross.project(document, edges, diagnostics);
        }

        Set<GraphEdge> distinctEdges = new LinkedHashSet<>(edges);
        Set<Diagnostic> distinctDiagnostics = new LinkedHashSet<>(diagnostics);
        List<List<String>> cycles = CycleDetector.cycles(nodes.keySet(), distinctEdges);
        if (!cycles.isEmpty()) {
            log.warn("Obligation graph has {} cycle(s); kept as-is", cycles.size());
        }
        log.info("Projected {} documents into {} nodes, {} edges, {} diagnostics",
                corpus.size(), nodes.size(), distinctEdges.size(), distinctDiagnostics.size());
        return new ObligationGraph(new ArrayList<>(nodes.values()), new ArrayList<>(distinctEdges),
                cycles, new ArrayList<>(distinctDiagnostics));
    }
}
