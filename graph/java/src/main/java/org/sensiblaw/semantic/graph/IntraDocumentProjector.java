package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.lexicon.PhrasePattern;
import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.logic.LogicNode;
import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.logic.NodeType;
import org.sensiblaw.semantic.model.TextSpan;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Edges inside one document. A trigger is a CONDITION node ({@code conditional_on}), an
 * EXCEPTION node ({@code exception_to}) or a dependency phrase such as
 * {@code in accordance with section 5} ({@code depends_on}). Only internal provision
 * references inside the trigger are followed.
 */
final class IntraDocumentProjector {

    private static final Logger log = LoggerFactory.getLogger(IntraDocumentProjector.class);

    private final LegalLexicon lexicon;
    private final ReferenceResolver resolver;

    IntraDocumentProjector(LegalLexicon lexicon, ReferenceResolver resolver) {
        this.lexicon = lexicon;
        this.resolver = resolver;
    }

    private record Trigger(EdgeKind kind, TextSpan span, String text) {}

    void project(CorpusDocument document, List<GraphEdge> edges, List<Diagnostic> diagnostics) {
        LogicTree tree = document.analysis().tree();
        List<String> normalized = TokenNormalizer.normalizeAll(tree.stream().tokens());
        List<Reference> references = document.analysis().references();
        List<String> hashes = ReferenceHashes.of(document.analysis());

        for (ObligationIdentity obligation : document.analysis().obligations()) {
            LogicNode clause = tree.node(obligation.clauseId());
            for (Trigger trigger : triggers(tree, clause, normalized)) {
                for (int r = 0; r < references.size(); r++) {
                    Reference reference = references.get(r);
                    if (!reference.isInternal() || !trigger.span().contains(reference.span())) continue;
                    List<ObligationIdentity> targets = resolver.resolve(document, reference, hashes.get(r));
                    if (targets.isEmpty()) {
                        log.debug("Unresolved {} trigger '{}' in {}", trigger.kind().wireName(),
                                trigger.text(), document.sourceId());
                        diagnostics.add(new Diagnostic(Diagnostic.ReasonCode.UNRESOLVED_REFERENCE,
                                document.sourceId(), clause.id(), reference.citationText()));
                        continue;
                    }
                    for (ObligationIdentity target : targets) {
                        edges.add(new GraphEdge(trigger.kind(), obligation.identityHash(), target.identityHash(),
                                trigger.text(), new EdgeProvenance(document.sourceId(), clause.id(), hashes.get(r))));
                    }
                }
            }
        }
    }

    private List<Trigger> triggers(LogicTree tree, LogicNode clause, List<String> normalized) {
        List<Trigger> triggers = new ArrayList<>();
        List<LogicNode> markers = new ArrayList<>(tree.descendants(clause, NodeType.CONDITION));
        markers.addAll(tree.descendants(clause, NodeType.EXCEPTION));
        for (LogicNode marker : markers) {
            EdgeKind kind = marker.type() == NodeType.CONDITION ? EdgeKind.CONDITIONAL_ON : EdgeKind.EXCEPTION_TO;
            triggers.add(new Trigger(kind, marker.span(), marker.text()));
        }
        List<LogicNode> references = tree.descendants(clause, NodeType.REFERENCE);
        TextSpan span = clause.span();
        for (int i = span.start(); i < span.end(); i++) {
            final int at = i;
            if (markers.stream().anyMatch(m -> m.span().contains(at))) continue;
            Optional<PhrasePattern> dependency = lexicon.dependencyMarkerAt(normalized, i);
            if (dependency.isEmpty()) continue;
            int cueEnd = dependency.get().endAt(normalized, i);
            // the reference must follow the cue, allowing one article in between
            Optional<LogicNode> target = references.stream()
                    .filter(n -> n.span().start() >= cueEnd && n.span().start() <= cueEnd + 1)
                    .findFirst();
            if (target.isPresent()) {
                TextSpan triggerSpan = tree.stream().span(i, target.get().span().end());
                triggers.add(new Trigger(EdgeKind.DEPENDS_ON, triggerSpan, tree.stream().text(triggerSpan)));
                i = triggerSpan.end() - 1;
            }
        }
        return triggers;
    }
}
