package org.sensiblaw.semantic.graph;

import org.sensiblaw.semantic.DocumentAnalysis;
import org.sensiblaw.semantic.reference.ReferenceIdentity;

import java.util.List;

final class ReferenceHashes {

    private ReferenceHashes() {}

    /** CR-ID hash of each reference of {@code analysis}, index-aligned with {@code references()}. */
    static List<String> of(DocumentAnalysis analysis) {
        if (analysis.identities().size() != analysis.references().size()) {
            throw new IllegalStateException("Reference identities of " + analysis.docId()
                    + " are not aligned with its references");
        }
        return analysis.identities().stream().map(ReferenceIdentity::identityHash).toList();
    }
}
