package org.sensiblaw.semantic.obligation;

import java.util.List;

/**
 * OBL-ID of one atom.
 *
 * @param identityHash  the hash
 * @param positionIndex occurrence ordinal among atoms of the document with the same identity payload
 * @param atom          the identified atom
 */
public record ObligationIdentity(String identityHash, int positionIndex, ObligationAtom atom) {

    public String clauseId() {
        return atom.clauseId();
    }

    public List<String> referenceIdentities() {
        return atom.referenceIdentities();
    }
}
