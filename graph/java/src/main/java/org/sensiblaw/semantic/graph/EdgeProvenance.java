package org.sensiblaw.semantic.graph;

/**
 * Where an edge was read from.
 *
 * @param sourceId    document holding the trigger
 * @param clauseId    clause holding the trigger
 * @param referenceId CR-ID hash of the reference the edge resolved through
 */
public record EdgeProvenance(String sourceId, String clauseId, String referenceId) {}
