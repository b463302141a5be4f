package org.sensiblaw.semantic;

import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.obligation.ObligationRefiner;
import org.sensiblaw.semantic.reference.Reference;
import org.sensiblaw.semantic.reference.ReferenceIdentity;

import java.util.List;

/**
 * Every artifact derived from one document revision, in stage order.
 *
 * @param tree        the logic tree
 * @param references  raw reference mentions, clause by clause
 * @param identities  CR-IDs, one per reference
 * @param refinement  raw, normalized and consolidated obligation atoms
 * @param obligations OBL-IDs of the consolidated atoms
 */
public record DocumentAnalysis(
        LogicTree tree,
        List<Reference> references,
        List<ReferenceIdentity> identities,
        ObligationRefiner.Refinement refinement,
        List<ObligationIdentity> obligations
) {
    public DocumentAnalysis {
        references = List.copyOf(references);
        identities = List.copyOf(identities);
        obligations = List.copyOf(obligations);
    }

    public String docId() {
        return tree.docId();
    }

    public String revId() {
        return tree.revId();
    }
}
