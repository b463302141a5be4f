package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.TestDocuments;
import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.logic.LogicTreeBuilder;
import org.sensiblaw.semantic.logic.NodeType;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObligationExtractorTest {

    private final LogicTreeBuilder builder = new LogicTreeBuilder();
    private final ObligationExtractor extractor = new ObligationExtractor();

    private List<ObligationAtom> extract(String text) {
        return extractor.extract(builder.build(TestDocuments.tokens(text)));
    }

    private static String normalized(PhraseAtom phrase) {
        return phrase != null ? phrase.normalized() : null;
    }

    @Test
    void prohibitionWithException() {
        List<ObligationAtom> atoms = extract("A person must not sell spray paint unless licensed.");
        assertEquals(1, atoms.size());
        ObligationAtom atom = atoms.get(0);
        assertEquals(ObligationType.PROHIBITION, atom.type());
        assertEquals("must not", atom.modality());
        assertEquals("a person", normalized(atom.actor()));
        assertEquals("sell", normalized(atom.action()));
        assertEquals("spray paint", normalized(atom.object()));
        assertEquals(1, atom.conditions().size());
        ConditionAtom condition = atom.conditions().get(0);
        assertEquals(ConditionType.UNLESS, condition.type());
        assertTrue(condition.type().isException());
        assertEquals("licensed", condition.normalized());
    }

    @Test
    void bindingsCanBeSwitchedOff() {
        LogicTree tree = builder.build(TestDocuments.tokens("A person must not sell spray paint unless licensed."));
        ObligationAtom noActor = extractor.extract(tree, new ExtractionConfig(false, true)).get(0);
        assertNull(noActor.actor());
        assertEquals("sell", normalized(noActor.action()));

        ObligationAtom noAction = extractor.extract(tree, new ExtractionConfig(true, false)).get(0);
        assertEquals("a person", normalized(noAction.actor()));
        assertNull(noAction.action());
        assertNull(noAction.object());
        assertEquals(ConditionType.UNLESS, noAction.conditions().get(0).type());
    }

    @Test
    void scopeAndLifecycleAttachWithoutChangingTheAction() {
        ObligationAtom atom = extract("A licensee must, within 7 days, notify the Commissioner upon commencement.").get(0);
        assertEquals("a licensee", normalized(atom.actor()));
        assertEquals("notify", normalized(atom.action()));
        assertEquals("the commissioner", normalized(atom.object()));

        assertEquals(1, atom.scopes().size());
        assertEquals(ScopeCategory.TIME, atom.scopes().get(0).category());
        assertEquals("within 7 days", atom.scope(ScopeCategory.TIME).orElseThrow().normalized());

        LifecycleTrigger trigger = atom.activationTrigger().orElseThrow();
        assertEquals("upon commencement", trigger.normalized());
        assertEquals("upon", trigger.cue());
        assertEquals("commencement", trigger.withoutCue());
        assertTrue(atom.terminationTrigger().isEmpty());
    }

    @Test
    void terminationCue() {
        ObligationAtom atom = extract("A licensee must display the licence until revoked.").get(0);
        assertEquals("the licence", normalized(atom.object()));
        LifecycleTrigger trigger = atom.terminationTrigger().orElseThrow();
        assertEquals(LifecycleKind.TERMINATION, trigger.kind());
        assertEquals("revoked", trigger.withoutCue());
    }

    @Test
    void referencesStayWithTheirClause() {
        List<ObligationAtom> atoms = extract("A retailer must comply with the Fines Act 1996. A licensee must keep records.");
        assertEquals(2, atoms.size());
        assertEquals(1, atoms.get(0).referenceIdentities().size());
        assertEquals("with the fines act 1996", normalized(atoms.get(0).object()));
        assertTrue(atoms.get(1).referenceIdentities().isEmpty());
        assertNotEquals(atoms.get(0).clauseId(), atoms.get(1).clauseId());
    }

    @Test
    void clauseWithoutModalYieldsNothing() {
        assertTrue(extract("The Act applies to every retailer.").isEmpty());
    }

    @Test
    void exclusionBindsObjectOnly() {
        ObligationAtom atom = extract("The fee does not apply to a licensee.").get(0);
        assertEquals(ObligationType.EXCLUSION, atom.type());
        assertEquals("does not apply", atom.modality());
        assertEquals("the fee", normalized(atom.actor()));
        assertNull(atom.action());
        assertEquals("a licensee", normalized(atom.object()));
    }

    @Test
    void coordinatedVerbsYieldOneAtomEach() {
        String[][] words = {
                {"A", ""}, {"retailer", "NOUN"}, {"must", "AUX"}, {"keep", "VERB"}, {"records", "NOUN"},
                {"and", "CCONJ"}, {"retain", "VERB"}, {"receipts", "NOUN"}, {".", "PUNCT"}};
        List<Token> tokens = new ArrayList<>();
        int offset = 0;
        for (String[] word : words) {
            tokens.add(new Token(word[0], null, word[1], null, offset, offset + word[0].length()));
            offset += word[0].length() + 1;
        }
        TokenStream stream = new TokenStream("doc", "r1", tokens, List.of(tokens.size()), null);

        List<ObligationAtom> atoms = extractor.extract(builder.build(stream));
        assertEquals(2, atoms.size());
        assertEquals("keep", normalized(atoms.get(0).action()));
        assertEquals("records", normalized(atoms.get(0).object()));
        assertEquals("retain", normalized(atoms.get(1).action()));
        assertEquals("receipts", normalized(atoms.get(1).object()));
        assertEquals("a retailer", normalized(atoms.get(1).actor()));
        assertEquals(atoms.get(0).clauseId(), atoms.get(1).clauseId());
    }

    @Test
    void provenanceNamesClauseAndModal() {
        LogicTree tree = builder.build(TestDocuments.tokens("retail-code", "v1", TestDocuments.fixture("retail-code-v1.txt")));
        List<ObligationAtom> atoms = extractor.extract(tree);
        assertEquals(3, atoms.size());
        for (int i = 0; i < atoms.size(); i++) {
            ObligationProvenance provenance = atoms.get(i).provenance();
            assertEquals("retail-code", provenance.sourceId());
            assertEquals("v1", provenance.revId());
            assertEquals(i, provenance.clauseIndex());
            assertEquals(Integer.toString(i + 1), provenance.clauseLabel());
            assertEquals(List.of(1), provenance.pages());
            assertEquals(NodeType.MODAL, tree.node(provenance.anchorUsed()).type());
        }
        assertEquals("a retailer", normalized(atoms.get(0).actor()));
        assertEquals("within 7 days", atoms.get(2).scope(ScopeCategory.TIME).orElseThrow().normalized());
    }

    @Test
    void exceptionBetweenModalAndVerbKeepsActionAndObject() {
        ObligationAtom atom = extract("A person must not, unless licensed, sell spray paint.").get(0);
        assertEquals(ObligationType.PROHIBITION, atom.type());
        assertEquals("a person", normalized(atom.actor()));
        assertEquals("sell", normalized(atom.action()));
        assertEquals("spray paint", normalized(atom.object()));
        assertEquals(ConditionType.UNLESS, atom.conditions().get(0).type());
        assertEquals("licensed", atom.conditions().get(0).normalized());

        ObligationAtom trailing = extract("A person must not sell spray paint unless licensed.").get(0);
        assertEquals(ObligationPayloads.identityPayload(trailing), ObligationPayloads.identityPayload(atom));
    }

    @Test
    void conditionBetweenModalAndVerbKeepsActionAndObject() {
        ObligationAtom atom = extract("The holder of a licence must, if directed, produce the licence.").get(0);
        assertEquals("the holder of a licence", normalized(atom.actor()));
        assertEquals("produce", normalized(atom.action()));
        assertEquals("the licence", normalized(atom.object()));
        assertEquals(ConditionType.IF, atom.conditions().get(0).type());
        assertEquals("directed", atom.conditions().get(0).normalized());
    }

    @Test
    void subjectAfterExceptThatBelongsToTheNextModal() {
        List<ObligationAtom> atoms = extract("A person must not sell spray paint except that a licensee may sell it.");
        assertEquals(3, atoms.size());

        assertEquals(ObligationType.PROHIBITION, atoms.get(0).type());
        assertEquals("a person", normalized(atoms.get(0).actor()));

        ObligationAtom exclusion = atoms.get(1);
        assertEquals(ObligationType.EXCLUSION, exclusion.type());
        assertNull(exclusion.object());

        ObligationAtom permission = atoms.get(2);
        assertEquals(ObligationType.PERMISSION, permission.type());
        assertEquals("a licensee", normalized(permission.actor()));
        assertEquals("sell", normalized(permission.action()));
        assertEquals("it", normalized(permission.object()));
    }

    @Test
    void modalWordInsideLeadingConditionIsNotADuty() {
        List<ObligationAtom> atoms = extract("If a licence is required, the holder must renew it.");
        assertEquals(1, atoms.size());
        ObligationAtom atom = atoms.get(0);
        assertEquals("must", atom.modality());
        assertEquals("the holder", normalized(atom.actor()));
        assertEquals("renew", normalized(atom.action()));
        assertEquals("it", normalized(atom.object()));
        assertEquals(ConditionType.IF, atom.conditions().get(0).type());
        assertEquals("a licence is required", atom.conditions().get(0).normalized());
    }

    @Test
    void strayPunctuationInsideModalKeepsTheModality() {
        ObligationAtom clean = extract("A person must not sell paint.").get(0);
        for (String noisy : List.of("A person must ( not sell paint.", "A person must \"not sell paint.")) {
            ObligationAtom atom = extract(noisy).get(0);
            assertEquals(ObligationType.PROHIBITION, atom.type(), noisy);
            assertEquals("must not", atom.modality(), noisy);
            assertEquals("sell", normalized(atom.action()), noisy);
            assertEquals("paint", normalized(atom.object()), noisy);
            assertEquals(ObligationPayloads.identityPayload(clean), ObligationPayloads.identityPayload(atom), noisy);
        }
    }

    @Test
    void quotedRunContinuesTheObject() {
        ObligationAtom atom = extract("A licensee must display the sign \"No Smoking\".").get(0);
        assertEquals("display", normalized(atom.action()));
        assertEquals("the sign no smoking", normalized(atom.object()));
    }
}
