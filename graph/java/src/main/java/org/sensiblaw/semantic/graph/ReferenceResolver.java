package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.reference.Reference;
import org.sensiblaw.semantic.reference.ReferenceCanonicalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a reference read from one document to the obligations it points at.
 *
 * <ul>
 *   <li>internal provisions ({@code see Part 4}) resolve to obligations of the same
 *       document whose clause label is the provision number</li>
 *   <li>every other reference resolves to obligations of other documents carrying the
 *       same reference identity</li>
 * </ul>
 */
final class ReferenceResolver {

    private final List<CorpusDocument> corpus;
    private final ReferenceCanonicalizer canonicalizer;

    ReferenceResolver(List<CorpusDocument> corpus, ReferenceCanonicalizer canonicalizer) {
        this.corpus = corpus;
        this.canonicalizer = canonicalizer;
    }

    List<ObligationIdentity> resolve(CorpusDocument source, Reference reference, String referenceHash) {
        if (reference.isInternal()) {
            return byClauseLabel(source, reference);
        }
        List<ObligationIdentity> targets = new ArrayList<>();
        for (CorpusDocument document : corpus) {
            if (document.sourceId().equals(source.sourceId())) continue;
            for (ObligationIdentity candidate : document.analysis().obligations()) {
                if (candidate.referenceIdentities().contains(referenceHash)) targets.add(candidate);
            }
        }
        return targets;
    }

    private List<ObligationIdentity> byClauseLabel(CorpusDocument source, Reference reference) {
        String section = canonicalizer.canonicalSection(reference.section());
        String[] parts = section.split(" ", 2);
        String designator = parts.length == 2 ? parts[0] : null;
        String number = parts.length == 2 ? parts[1] : parts[0];
        List<ObligationIdentity> targets = new ArrayList<>();
        for (ObligationIdentity candidate : source.analysis().obligations()) {
            String label = candidate.atom().provenance() != null ? candidate.atom().provenance().clauseLabel() : null;
            if (label == null) continue;
            if (Objects.equals(canonicalizer.canonicalNumber(designator, label), number)) {
                targets.add(candidate);
            }
        }
        return targets;
    }
}
