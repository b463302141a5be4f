package org.sensiblaw.semantic.model;

import java.util.List;

/**
 * A sentence as segmented by the NLP collaborator.
 */
public record Sentence(List<Token> tokens) {
    public Sentence {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
    }
}
