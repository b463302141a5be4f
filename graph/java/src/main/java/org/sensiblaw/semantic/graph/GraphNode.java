package org.sensiblaw.semantic.graph;

import java.util.List;

/**
 * @param oblId               OBL-ID of the obligation
 * @param sourceId            document the obligation was first seen in
 * @param clauseId            CLAUSE node the obligation came from
 * @param referenceIdentities CR-ID hashes carried by the obligation
 */
public record GraphNode(String oblId, String sourceId, String clauseId, List<String> referenceIdentities) {
    public GraphNode {
        referenceIdentities = referenceIdentities != null ? List.copyOf(referenceIdentities) : List.of();
    }
}
