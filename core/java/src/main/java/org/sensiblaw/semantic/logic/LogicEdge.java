package org.sensiblaw.semantic.logic;

public record LogicEdge(EdgeType type, String sourceId, String targetId) {}
