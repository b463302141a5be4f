package org.sensiblaw.semantic.model;

/**
 * Thrown when a span points outside the token stream it claims to index.
 *
 * <p>This is a contract breach by whoever produced the span, never a data-quality
 * condition, so it is not recovered from.
 */
public class SpanOutOfBoundsException extends IllegalArgumentException {

    public SpanOutOfBoundsException(TextSpan span, int streamSize) {
        super("Span " + span + " is outside token stream of size " + streamSize
                + " (doc '" + span.docId() + "', rev '" + span.revId() + "')");
    }

    public SpanOutOfBoundsException(String message) {
        super(message);
    }
}
