package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

/**
 * Explicit activation or termination phrasing, e.g. {@code upon commencement} or
 * {@code until the licence expires}.
 *
 * @param cue        normalized cue word(s) that opened the phrase
 * @param normalized normalized phrase including the cue
 */
public record LifecycleTrigger(LifecycleKind kind, String text, String normalized, String cue,
                               TextSpan span, String clauseId) {

    /** Normalized phrase with its cue removed, e.g. {@code commencement} for {@code upon commencement}. */
    public String withoutCue() {
        if (normalized.equals(cue)) return "";
        return normalized.startsWith(cue + " ") ? normalized.substring(cue.length() + 1) : normalized;
    }
}
