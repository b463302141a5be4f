package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.citation.CitationMatch;
import org.sensiblaw.semantic.citation.CitationMatcher;
import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.logic.LogicNode;
import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.logic.NodeType;
import org.sensiblaw.semantic.model.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads raw {@link Reference} mentions from the REFERENCE nodes of a tree, clause by clause.
 */
public class ReferenceExtractor {

    private final CitationMatcher citations;

    public ReferenceExtractor() {
        this(LegalLexicon.defaults());
    }

    public ReferenceExtractor(LegalLexicon lexicon) {
        this.citations = new CitationMatcher(lexicon);
    }

    public List<Reference> extract(LogicTree tree) {
        List<Reference> references = new ArrayList<>();
        String source = tree.docId() + "@" + tree.revId();
        for (LogicNode clause : tree.clauses()) {
            for (LogicNode node : tree.descendants(clause, NodeType.REFERENCE)) {
                TextSpan span = node.span();
                CitationMatch match = citations.matchExact(tree.stream().tokens(), span.start(), span.end())
                        .orElseThrow(() -> new IllegalStateException(
                                "REFERENCE node " + node.id() + " " + span + " no longer parses as a citation"));
                ReferenceProvenance provenance = new ReferenceProvenance(
                        clause.id(), tree.stream().pageMap().pagesFor(span), source, node.id());
                references.add(new Reference(match.kind(), match.work(), match.section(), match.pinpoint(),
                        match.text(), clause.id(), span, provenance));
            }
        }
        return references;
    }
}
