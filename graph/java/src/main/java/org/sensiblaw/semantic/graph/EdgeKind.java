package org.sensiblaw.semantic.graph;

/**
 * Closed set of obligation graph edge kinds. The first three come from in-clause
 * triggers inside one document; the last four from the frozen cross-document grammar.
 */
public enum EdgeKind {
    CONDITIONAL_ON,
    EXCEPTION_TO,
    DEPENDS_ON,
    REPEALS,
    MODIFIES,
    REFERENCES,
    CITES;

    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isCrossDocument() {
        return switch (this) {
            case REPEALS, MODIFIES, REFERENCES, CITES -> true;
            case CONDITIONAL_ON, EXCEPTION_TO, DEPENDS_ON -> false;
        };
    }
}
