package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.identity.IdentityHashing;

/**
 * {@code cr_id_v1}: {@code sha256(cr_id_v1 ␟ family_key ␟ year ␟ jurisdiction_hint)}.
 *
 * <p>Family keys:
 * <ul>
 *   <li>acts: canonical title words without year and jurisdiction, e.g. {@code crimes-act}</li>
 *   <li>neutral citations and law reports: court or series plus number, e.g. {@code hca-23}</li>
 *   <li>bare provisions: {@code self-} plus the canonical provision, e.g. {@code self-part-4}</li>
 * </ul>
 */
public final class CrIdV1 implements ReferenceIdentityScheme {

    public static final String NAME = "cr_id_v1";

    private final ReferenceCanonicalizer canonicalizer;

    public CrIdV1() {
        this(new ReferenceCanonicalizer());
    }

    public CrIdV1(ReferenceCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReferenceIdentity identify(Reference reference) {
        String family;
        Integer year = null;
        String jurisdiction = null;
        switch (reference.kind()) {
            case PROVISION -> family = "self-" + canonicalizer.canonicalSection(reference.section()).replace(' ', '-');
            case NEUTRAL_CITATION, LAW_REPORT -> {
                family = canonicalizer.workFamily(reference.work()) + "-"
                        + canonicalizer.canonicalNumber(null, reference.section());
                year = canonicalizer.year(reference.work());
            }
            case ACT -> {
                family = canonicalizer.workFamily(reference.work());
                year = canonicalizer.year(reference.work());
                jurisdiction = canonicalizer.jurisdiction(reference.work());
            }
            default -> throw new IllegalArgumentException("Unsupported citation kind " + reference.kind());
        }
        String hash = IdentityHashing.hashParts(NAME, family, year != null ? year.toString() : "", jurisdiction);
        return new ReferenceIdentity(hash, family, year, jurisdiction, reference.provenance());
    }
}
