package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

/**
 * A typed condition or exception attached to an obligation.
 *
 * @param text       the condition body after its marker, e.g. {@code licensed} for {@code unless licensed}
 * @param normalized normalized body
 * @param span       span of the marker and body
 */
public record ConditionAtom(ConditionType type, String text, String normalized, TextSpan span, String clauseId) {}
