package org.sensiblaw.semantic.graph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.sensiblaw.semantic.graph.GraphFixtures.document;
import static org.sensiblaw.semantic.graph.GraphFixtures.obligation;
import static org.sensiblaw.semantic.graph.GraphFixtures.project;

class ObligationGraphProjectorTest {

    @Test
    void unresolvedInternalReferenceIsDiagnosedNotGuessed() {
        CorpusDocument doc = document("licensing", "A licensee must display the licence, see Part 4.");
        ObligationGraph graph = project(doc);

        assertEquals(1, graph.nodes().size());
        assertTrue(graph.edges().isEmpty());
        assertEquals(1, graph.diagnostics().size());
        Diagnostic diagnostic = graph.diagnostics().get(0);
        assertEquals(Diagnostic.ReasonCode.UNRESOLVED_REFERENCE, diagnostic.code());
        assertEquals("licensing", diagnostic.sourceId());
        assertEquals("Part 4", diagnostic.detail());
    }

    @Test
    void internalReferenceResolvesThroughClauseLabel() {
        CorpusDocument doc = document("licensing",
                "4. A retailer must keep records. A licensee must display the licence, see Part 4.");
        ObligationGraph graph = project(doc);

        assertEquals(1, graph.edges().size());
        GraphEdge edge = graph.edges().get(0);
        assertEquals(EdgeKind.REFERENCES, edge.kind());
        assertEquals(obligation(doc, "display"), edge.from());
        assertEquals(obligation(doc, "keep"), edge.to());
        assertEquals("see", edge.text());
        assertEquals("licensing", edge.provenance().sourceId());
        assertTrue(graph.diagnostics().isEmpty());
    }

    @Test
    void repealMarkerLinksDocumentsSharingAReference() {
        CorpusDocument repealing = document("amending-act", "The Minister must repeal section 1 of the Old Act 1990.");
        CorpusDocument repealed = document("old-act", "An operator must comply with section 1 of the Old Act 1990.");
        ObligationGraph graph = project(repealed, repealing);

        assertEquals(2, graph.nodes().size());
        assertEquals(1, graph.edges().size());
        GraphEdge edge = graph.edges().get(0);
        assertEquals(EdgeKind.REPEALS, edge.kind());
        assertEquals(obligation(repealing, "repeal"), edge.from());
        assertEquals(obligation(repealed, "comply"), edge.to());
        assertEquals("repeal", edge.text());

        String referenceId = edge.provenance().referenceId();
        assertEquals(List.of(edge.from(), edge.to()).stream().sorted().toList(), graph.obligationsFor(referenceId));
        assertEquals("old-act", graph.node(edge.to()).sourceId());
    }

    @Test
    void forbiddenMarkerSuppressesEdges() {
        CorpusDocument doc = document("licensing",
                "4. A retailer must keep records. A licensee must display the licence, see Part 4, which prevails.");
        ObligationGraph graph = project(doc);

        assertTrue(graph.edges().isEmpty());
        assertEquals(1, graph.diagnostics().size());
        assertEquals(Diagnostic.ReasonCode.FORBIDDEN_MARKER, graph.diagnostics().get(0).code());
        assertEquals("prevails", graph.diagnostics().get(0).detail());
    }

    @Test
    void markerWithoutReferenceIsDiagnosed() {
        ObligationGraph graph = project(document("fees", "The Minister may amend the fee schedule."));
        assertTrue(graph.edges().isEmpty());
        assertEquals(Diagnostic.ReasonCode.NO_REFERENCE_IN_CLAUSE, graph.diagnostics().get(0).code());
        assertEquals("amend", graph.diagnostics().get(0).detail());
    }

    @Test
    void exceptionPointingAtAnotherClause() {
        CorpusDocument doc = document("retail",
                "1. A retailer must keep records. (2) A person must not sell paint unless licensed under section 1.");
        ObligationGraph graph = project(doc);

        assertEquals(1, graph.edges().size());
        GraphEdge edge = graph.edges().get(0);
        assertEquals(EdgeKind.EXCEPTION_TO, edge.kind());
        assertEquals(obligation(doc, "sell"), edge.from());
        assertEquals(obligation(doc, "keep"), edge.to());
        assertEquals("unless licensed under section 1", edge.text());
    }

    @Test
    void conditionPointingAtAnotherClause() {
        CorpusDocument doc = document("retail",
                "1. A retailer must keep records. 2. A person may sell paint if registered under section 1.");
        ObligationGraph graph = project(doc);

        assertEquals(1, graph.edges().size());
        GraphEdge edge = graph.edges().get(0);
        assertEquals(EdgeKind.CONDITIONAL_ON, edge.kind());
        assertEquals(obligation(doc, "sell"), edge.from());
        assertEquals(obligation(doc, "keep"), edge.to());
        assertEquals("if registered under section 1", edge.text());
    }

    @Test
    void dependencyPhraseYieldsDependsOn() {
        CorpusDocument doc = document("retail",
                "1. A retailer must keep records. 2. A licensee must keep receipts in accordance with section 1.");
        ObligationGraph graph = project(doc);

        assertEquals(1, graph.edges().size());
        GraphEdge edge = graph.edges().get(0);
        assertEquals(EdgeKind.DEPENDS_ON, edge.kind());
        assertEquals("in accordance with section 1", edge.text());
        assertFalse(graph.hasCycles());
    }

    @Test
    void mutualDependencyIsAnnotatedAsCycle() {
        CorpusDocument doc = document("retail",
                "1. A retailer must keep records in accordance with section 2. "
                        + "2. A licensee must keep receipts in accordance with section 1.");
        ObligationGraph graph = project(doc);

        assertEquals(2, graph.edges().size());
        assertTrue(graph.hasCycles());
        assertEquals(1, graph.cycles().size());
        assertEquals(2, graph.cycles().get(0).size());
        graph.nodes().forEach(node -> assertTrue(graph.inCycle(node.oblId())));
    }

    @Test
    void duplicateEdgesCollapse() {
        CorpusDocument doc = document("licensing",
                "4. A retailer must keep records. A licensee must display the licence, see Part 4 and Part IV.");
        ObligationGraph graph = project(doc);
        assertEquals(1, graph.edges().size());
    }

    @Test
    void edgesUseTheClosedGrammar() {
        ObligationGraph graph = project(
                document("a", "The Minister must repeal section 1 of the Old Act 1990. 4. A retailer must keep records."),
                document("b", "An operator must comply with section 1 of the Old Act 1990."),
                document("c", "1. A retailer must keep records. (2) A person must not sell paint unless licensed under section 1."));
        assertFalse(graph.edges().isEmpty());
        for (GraphEdge edge : graph.edges()) {
            assertTrue(graph.contains(edge.from()));
            assertTrue(graph.contains(edge.to()));
            if (edge.kind().isCrossDocument()) {
                assertTrue(CrossDocGrammar.matches(edge.kind(), edge.text()), edge::toString);
            }
        }
        List<GraphEdge> sorted = new ArrayList<>(graph.edges());
        sorted.sort(GraphEdge.ORDER);
        assertEquals(sorted, graph.edges());
    }

    @Test
    void projectionIgnoresInputOrder() {
        CorpusDocument a = document("a", "The Minister must repeal section 1 of the Old Act 1990.");
        CorpusDocument b = document("b", "An operator must comply with section 1 of the Old Act 1990.");
        assertEquals(GraphPayloads.toJson(project(a, b)), GraphPayloads.toJson(project(b, a)));
    }

    @Test
    void sharedObligationKeepsFirstSource() {
        CorpusDocument a = document("a", "A retailer must keep records.");
        CorpusDocument b = document("b", "A retailer must keep records.");
        ObligationGraph graph = project(b, a);
        assertEquals(1, graph.nodes().size());
        assertEquals("a", graph.nodes().get(0).sourceId());
        assertThrows(NoSuchElementException.class, () -> graph.node("missing"));
    }
}
