package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.logic.LogicNode;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Edges driven by the {@link CrossDocGrammar}. An edge needs a marker in the clause text
 * and a reference in the same clause that resolves to a known obligation; anything less
 * yields a {@link Diagnostic} instead. A forbidden marker anywhere in the clause blocks
 * every marker edge from it.
 */
final class CrossDocumentProjector {

    private static final Logger log = LoggerFactory.getLogger(CrossDocumentProjector.class);

    private final ReferenceResolver resolver;

    CrossDocumentProjector(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    void project(CorpusDocument document, List<GraphEdge> edges, List<Diagnostic> diagnostics) {
        List<Reference> references = document.analysis().references();
        List<String> hashes = ReferenceHashes.of(document.analysis());

        for (ObligationIdentity obligation : document.analysis().obligations()) {
            LogicNode clause = document.analysis().tree().node(obligation.clauseId());
            String text = clause.text();
            String forbidden = CrossDocGrammar.forbiddenMarker(text);
            if (forbidden != null) {
                log.debug("Forbidden marker '{}' in clause {} of {}", forbidden, clause.id(), document.sourceId());
                diagnostics.add(new Diagnostic(Diagnostic.ReasonCode.FORBIDDEN_MARKER,
                        document.sourceId(), clause.id(), forbidden));
                continue;
            }
            List<CrossDocGrammar.MarkerMatch> markers = CrossDocGrammar.markers(text);
            if (markers.isEmpty()) continue;

            boolean anyReference = false;
            for (int r = 0; r < references.size(); r++) {
                Reference reference = references.get(r);
                if (!reference.clauseId().equals(clause.id())) continue;
                anyReference = true;
                List<ObligationIdentity> targets = resolver.resolve(document, reference, hashes.get(r));
                if (targets.isEmpty()) {
                    diagnostics.add(new Diagnostic(Diagnostic.ReasonCode.UNRESOLVED_REFERENCE,
                            document.sourceId(), clause.id(), reference.citationText()));
                    continue;
                }
                for (CrossDocGrammar.MarkerMatch marker : markers) {
                    for (ObligationIdentity target : targets) {
                        edges.add(new GraphEdge(marker.kind(), obligation.identityHash(), target.identityHash(),
                                marker.text(), new EdgeProvenance(document.sourceId(), clause.id(), hashes.get(r))));
                    }
                }
            }
            if (!anyReference) {
                diagnostics.add(new Diagnostic(Diagnostic.ReasonCode.NO_REFERENCE_IN_CLAUSE,
                        document.sourceId(), clause.id(), markers.get(0).text()));
            }
        }
    }
}
