package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

/** Time, place or context phrase. Attachment only: a scope never decides whether a duty exists. */
public record ScopeAtom(ScopeCategory category, String text, String normalized, TextSpan span, String clauseId) {}
