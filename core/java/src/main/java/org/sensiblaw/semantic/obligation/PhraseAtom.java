package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

/**
 * A clause-local phrase bound to an obligation: actor, action or object.
 *
 * @param text       surface text
 * @param normalized lower-cased, punctuation-trimmed, whitespace-collapsed form
 */
public record PhraseAtom(String text, String normalized, TextSpan span, String clauseId) {}
