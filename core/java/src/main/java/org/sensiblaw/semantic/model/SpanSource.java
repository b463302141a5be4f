package org.sensiblaw.semantic.model;

/**
 * Declares which offset space a {@link TextSpan} indexes into.
 */
public enum SpanSource {
    TOKEN,
    CHARACTER;

    public String wireName() {
        return name().toLowerCase();
    }
}
