package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.SemanticPipeline;
import org.sensiblaw.semantic.TestDocuments;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObligationAlignmentTest {

    private final SemanticPipeline pipeline = new SemanticPipeline();

    private List<ObligationIdentity> obligations(String rev, String text) {
        return pipeline.analyze(TestDocuments.tokens("permit", rev, text)).obligations();
    }

    @Test
    void scopeChangeIsModifiedNotAddedOrRemoved() {
        List<ObligationIdentity> before = obligations("r1",
                "A licensee must notify the Commissioner within 7 days. A retailer must keep records.");
        List<ObligationIdentity> after = obligations("r2",
                "A licensee must notify the Commissioner within 14 days. A retailer must keep records.");

        ObligationAlignment.AlignmentReport report = ObligationAlignment.align(before, after);
        assertTrue(report.added().isEmpty());
        assertTrue(report.removed().isEmpty());
        assertEquals(1, report.unchanged().size());
        assertEquals(1, report.modified().size());

        ObligationAlignment.AlignmentDelta delta = report.modified().get(0);
        assertEquals(1, delta.changes().size());
        ObligationAlignment.FieldChange change = delta.changes().get(0);
        assertEquals("scopes", change.field());
        assertEquals(List.of("time:within 7 days"), change.oldValue());
        assertEquals(List.of("time:within 14 days"), change.newValue());
    }

    @Test
    void newAndDroppedObligations() {
        List<ObligationIdentity> before = obligations("r1", "A retailer must keep records. A licensee must display the licence.");
        List<ObligationIdentity> after = obligations("r2", "A retailer must keep records. The Minister may waive the fee.");

        ObligationAlignment.AlignmentReport report = ObligationAlignment.align(before, after);
        assertEquals(1, report.added().size());
        assertEquals("waive", report.added().get(0).atom().action().normalized());
        assertEquals(1, report.removed().size());
        assertEquals("display", report.removed().get(0).atom().action().normalized());
        assertEquals(1, report.unchanged().size());
        assertTrue(report.modified().isEmpty());
    }

    @Test
    void clausePositionIsNotAMetadataChange() {
        List<ObligationIdentity> before = obligations("r1", "A retailer must keep records. A licensee must display the licence.");
        List<ObligationIdentity> after = obligations("r2", "A licensee must display the licence. A retailer must keep records.");
        ObligationAlignment.AlignmentReport report = ObligationAlignment.align(before, after);
        assertEquals(2, report.unchanged().size());
        assertTrue(report.modified().isEmpty());
    }

    @Test
    void payloadListsChanges() {
        List<ObligationIdentity> before = obligations("r1", "A licensee must display the licence.");
        List<ObligationIdentity> after = obligations("r2", "A licensee must display the licence until revoked.");

        Map<String, Object> payload = ObligationAlignment.toPayload(ObligationAlignment.align(before, after));
        assertEquals("obligation.alignment.v1", payload.get("version"));
        List<?> modified = (List<?>) payload.get("modified");
        assertEquals(1, modified.size());
        Map<?, ?> entry = (Map<?, ?>) modified.get(0);
        assertEquals(before.get(0).identityHash(), entry.get("identity_hash"));
        List<?> changes = (List<?>) entry.get("changes");
        assertEquals("lifecycle", ((Map<?, ?>) changes.get(0)).get("field"));
        assertEquals(List.of("termination:until revoked"), ((Map<?, ?>) changes.get(0)).get("new"));
    }
}
