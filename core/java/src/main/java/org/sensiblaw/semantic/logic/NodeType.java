package org.sensiblaw.semantic.logic;

/** Closed set of logic tree node types. */
public enum NodeType {
    ROOT,
    CLAUSE,
    CONDITION,
    MODAL,
    EXCEPTION,
    REFERENCE,
    TOKEN;

    /** True for node types that may hold children. */
    public boolean isContainer() {
        return switch (this) {
            case ROOT, CLAUSE, CONDITION, EXCEPTION -> true;
            case MODAL, REFERENCE, TOKEN -> false;
        };
    }

    /** Graphviz fill colour for DOT export. */
    public String dotColor() {
        return switch (this) {
            case ROOT -> "lightgrey";
            case CLAUSE -> "lightblue";
            case CONDITION -> "khaki";
            case MODAL -> "palegreen";
            case EXCEPTION -> "salmon";
            case REFERENCE -> "plum";
            case TOKEN -> "white";
        };
    }
}
