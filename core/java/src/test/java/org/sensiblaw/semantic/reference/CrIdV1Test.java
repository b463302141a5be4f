package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.TestDocuments;
import org.sensiblaw.semantic.citation.CitationKind;
import org.sensiblaw.semantic.identity.IdentityDiff;
import org.sensiblaw.semantic.logic.LogicTreeBuilder;
import org.sensiblaw.semantic.model.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrIdV1Test {

    private final CrIdV1 scheme = new CrIdV1();

    private static Reference act(String work, String section) {
        return new Reference(CitationKind.ACT, work, section, null, work, "clause",
                TextSpan.tokens("doc", "r1", 0, 1), null);
    }

    private static Reference provision(String section) {
        return new Reference(CitationKind.PROVISION, null, section, null, section, "clause",
                TextSpan.tokens("doc", "r1", 0, 1), null);
    }

    private List<ReferenceIdentity> identify(String docId, String text) {
        var tree = new LogicTreeBuilder().build(TestDocuments.tokens(docId, "r1", text));
        return ReferenceIdentities.identify(new ReferenceExtractor().extract(tree), scheme);
    }

    @Test
    void actIdentityFields() {
        ReferenceIdentity id = scheme.identify(act("Crimes Act 1900 (NSW)", "section 5"));
        assertEquals("crimes-act", id.familyKey());
        assertEquals(1900, id.year());
        assertEquals("nsw", id.jurisdictionHint());
        assertEquals(64, id.identityHash().length());
        assertEquals("cr_id_v1", scheme.name());
    }

    @Test
    void surfaceVariantsShareAnIdentity() {
        String expected = scheme.identify(act("Crimes Act 1900 (NSW)", null)).identityHash();
        assertEquals(expected, scheme.identify(act("the crimes act 19 00 ( N.S.W. )", null)).identityHash());
        assertEquals(expected, scheme.identify(act("Crimes Act 1900 (New South Wales)", null)).identityHash());
    }

    @Test
    void yearAndJurisdictionSeparateIdentities() {
        String base = scheme.identify(act("Crimes Act 1900 (NSW)", null)).identityHash();
        assertNotEquals(base, scheme.identify(act("Crimes Act 1914 (NSW)", null)).identityHash());
        assertNotEquals(base, scheme.identify(act("Crimes Act 1900 (Vic)", null)).identityHash());
        assertNotEquals(base, scheme.identify(act("Crimes Act 1900", null)).identityHash());
    }

    @Test
    void bareProvisionsUseSelfFamily() {
        ReferenceIdentity roman = scheme.identify(provision("Part IV"));
        ReferenceIdentity abbreviated = scheme.identify(provision("pt 4"));
        assertEquals("self-part-4", roman.familyKey());
        assertEquals(roman.identityHash(), abbreviated.identityHash());
        assertNull(roman.year());
    }

    @Test
    void neutralCitationFamilyCarriesNumber() {
        List<ReferenceIdentity> ids = identify("case", "As held in [1992] HCA 23, the rule applies.");
        assertEquals(1, ids.size());
        assertEquals("hca-23", ids.get(0).familyKey());
        assertEquals(1992, ids.get(0).year());
    }

    @Test
    void ocrNoiseDoesNotChangeTheReferenceSet() {
        List<ReferenceIdentity> clean = identify("a", "An offence against section 5 of the Crimes Act 1900 (NSW) is punishable.");
        List<ReferenceIdentity> noisy = identify("b", "An offence against section 5 of the Crimes Act 19 00 ( NSW ) is punishable.");
        assertEquals(1, clean.size());
        assertEquals(1, noisy.size());
        assertEquals(clean.get(0).identityHash(), noisy.get(0).identityHash());

        IdentityDiff diff = ReferenceIdentities.diff(clean, noisy);
        assertTrue(diff.isEmpty());
        assertEquals(List.of(clean.get(0).identityHash()), diff.unchanged());
    }

    @Test
    void provenanceNeverFeedsTheHash() {
        ReferenceIdentity a = identify("a", "Comply with the Fines Act 1996.").get(0);
        ReferenceIdentity b = identify("b", "Every retailer must, at all times, comply with the Fines Act 1996.").get(0);
        assertNotEquals(a.provenance(), b.provenance());
        assertEquals(a.identityHash(), b.identityHash());
        assertEquals(a.withoutProvenance().identityHash(), a.identityHash());
        assertNull(a.withoutProvenance().provenance());
    }
}
