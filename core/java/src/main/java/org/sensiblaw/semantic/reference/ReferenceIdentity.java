package org.sensiblaw.semantic.reference;

/**
 * Canonical reference identity (CR-ID). {@code identityHash} is a pure function of
 * {@code familyKey}, {@code year} and {@code jurisdictionHint}; provenance rides along.
 */
public record ReferenceIdentity(
        String identityHash,
        String familyKey,
        Integer year,
        String jurisdictionHint,
        ReferenceProvenance provenance
) {
    /** The same identity with provenance dropped. */
    public ReferenceIdentity withoutProvenance() {
        return new ReferenceIdentity(identityHash, familyKey, year, jurisdictionHint, null);
    }
}
