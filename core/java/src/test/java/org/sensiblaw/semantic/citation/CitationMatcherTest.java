package org.sensiblaw.semantic.citation;

import org.sensiblaw.semantic.TestDocuments;
import org.sensiblaw.semantic.model.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationMatcherTest {

    private final CitationMatcher matcher = new CitationMatcher();

    private List<CitationMatch> match(String text) {
        List<Token> tokens = TestDocuments.tokens(text).tokens();
        return matcher.match(tokens, 0, tokens.size());
    }

    private CitationMatch single(String text) {
        List<CitationMatch> found = match(text);
        assertEquals(1, found.size(), () -> "citations in '" + text + "': " + found);
        return found.get(0);
    }

    @Test
    void actWithYearAndJurisdiction() {
        CitationMatch m = single("A person must comply with the Crimes Act 1900 (NSW).");
        assertEquals(CitationKind.ACT, m.kind());
        assertEquals("Crimes Act 1900 (NSW)", m.work());
        assertNull(m.designator());
        assertEquals("Crimes Act 1900 (NSW)", m.text());
    }

    @Test
    void provisionOfAnAct() {
        CitationMatch m = single("An offence against section 5 of the Crimes Act 1900 is punishable.");
        assertEquals(CitationKind.ACT, m.kind());
        assertEquals("Crimes Act 1900", m.work());
        assertEquals("section", m.designator());
        assertEquals("5", m.number());
        assertEquals("section 5", m.section());
        assertFalse(m.isInternal());
    }

    @Test
    void actWithTrailingProvision() {
        CitationMatch m = single("See Crimes Act 1900 s 5(2).");
        assertEquals(CitationKind.ACT, m.kind());
        assertEquals("section", m.designator());
        assertEquals("5", m.number());
        assertEquals("(2)", m.pinpoint());
    }

    @Test
    void bareProvisionIsInternal() {
        CitationMatch m = single("The licensee must comply with Part IV.");
        assertEquals(CitationKind.PROVISION, m.kind());
        assertEquals("part", m.designator());
        assertEquals("IV", m.number());
        assertTrue(m.isInternal());
    }

    @Test
    void compactProvisionWithPinpoints() {
        CitationMatch m = single("A notice under s5(2)(a) must be in writing.");
        assertEquals(CitationKind.PROVISION, m.kind());
        assertEquals("5", m.number());
        assertEquals("(2)(a)", m.pinpoint());
    }

    @Test
    void neutralCitation() {
        CitationMatch m = single("As held in [1992] HCA 23, the rule applies.");
        assertEquals(CitationKind.NEUTRAL_CITATION, m.kind());
        assertEquals("[1992] HCA", m.work());
        assertEquals("23", m.number());
    }

    @Test
    void lawReportCitation() {
        CitationMatch m = single("Mabo was reported at (1992) 175 CLR 1 in full.");
        assertEquals(CitationKind.LAW_REPORT, m.kind());
        assertEquals("1", m.number());
    }

    @Test
    void ocrSplitYearIsJoined() {
        CitationMatch m = single("A person must comply with the Crimes Act 19 00 ( NSW ).");
        assertEquals(CitationKind.ACT, m.kind());
        assertEquals("Crimes Act 19 00 ( NSW )", m.work());
    }

    @Test
    void bareInstrumentWordNeedsQualifier() {
        assertTrue(match("The Act applies to every retailer.").isEmpty());
    }

    @Test
    void sentenceStartIsNotATitle() {
        assertTrue(match("The Minister may waive the fee.").isEmpty());
    }

    @Test
    void multipleCitationsInSourceOrder() {
        List<CitationMatch> found = match("Subject to section 4 and Part 2, see the Fines Act 1996.");
        assertEquals(3, found.size());
        assertTrue(found.get(0).start() < found.get(1).start());
        assertTrue(found.get(1).start() < found.get(2).start());
        assertEquals(CitationKind.ACT, found.get(2).kind());
    }

    @Test
    void matchExactRequiresWholeRange() {
        List<Token> tokens = TestDocuments.tokens("comply with section 5 now").tokens();
        assertTrue(matcher.matchExact(tokens, 2, 4).isPresent());
        assertTrue(matcher.matchExact(tokens, 2, 5).isEmpty());
    }
}
