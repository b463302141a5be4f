package org.sensiblaw.semantic.graph;

import com.fasterxml.jackson.databind.JsonNode;
import org.sensiblaw.semantic.json.CanonicalJson;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.sensiblaw.semantic.graph.GraphFixtures.document;
import static org.sensiblaw.semantic.graph.GraphFixtures.project;

class GraphPayloadsTest {

    private final ObligationGraph graph = project(
            document("amending-act", "The Minister must repeal section 1 of the Old Act 1990."),
            document("old-act", "An operator must comply with section 1 of the Old Act 1990."),
            document("licensing", "A licensee must display the licence, see Part 4."));

    @Test
    void payloadShape() throws Exception {
        JsonNode root = CanonicalJson.mapper().readTree(GraphPayloads.toJson(graph));
        assertEquals("obligation.crossdoc.v2", root.get("version").asText());
        assertEquals(3, root.get("nodes").size());
        assertEquals(1, root.get("edges").size());

        JsonNode edge = root.get("edges").get(0);
        assertEquals("repeals", edge.get("kind").asText());
        assertEquals("repeal", edge.get("text").asText());
        assertEquals("amending-act", edge.get("provenance").get("source_id").asText());
        assertEquals(64, edge.get("provenance").get("reference_id").asText().length());

        JsonNode diagnostic = root.get("diagnostics").get(0);
        assertEquals("unresolved_reference", diagnostic.get("code").asText());
        assertEquals("licensing", diagnostic.get("source_id").asText());
        assertTrue(root.get("cycles").isArray());
    }

    @Test
    void nodesAreSortedById() throws Exception {
        JsonNode nodes = CanonicalJson.mapper().readTree(GraphPayloads.toJson(graph)).get("nodes");
        for (int i = 1; i < nodes.size(); i++) {
            assertTrue(nodes.get(i - 1).get("obl_id").asText().compareTo(nodes.get(i).get("obl_id").asText()) < 0);
        }
    }

    @Test
    void jsonIsStable() {
        assertEquals(GraphPayloads.toJson(graph), GraphPayloads.toJson(graph));
    }
}
