package org.sensiblaw.semantic.logic;

/**
 * STRUCTURAL edges form the containment tree. SEQUENCE edges only record sibling order
 * and carry no meaning.
 */
public enum EdgeType {
    STRUCTURAL,
    SEQUENCE
}
