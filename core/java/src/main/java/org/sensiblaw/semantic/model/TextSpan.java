package org.sensiblaw.semantic.model;

/**
 * Immutable locator into the canonical token stream of one document revision.
 *
 * <p>{@code start} is inclusive, {@code end} exclusive. Spans are never rewritten;
 * higher-level artifacts only reference them.
 */
public record TextSpan(
        String docId,
        String revId,
        int start,
        int end,
        SpanSource source
) {
    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        source = source != null ? source : SpanSource.TOKEN;
    }

    public static TextSpan tokens(String docId, String revId, int start, int end) {
        return new TextSpan(docId, revId, start, end, SpanSource.TOKEN);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /** True if {@code other} lies inside this span of the same revision and offset space. */
    public boolean contains(TextSpan other) {
        return sameSpace(other) && start <= other.start && other.end <= end;
    }

    public boolean contains(int index) {
        return start <= index && index < end;
    }

    public boolean overlaps(TextSpan other) {
        return sameSpace(other) && start < other.end && other.start < end;
    }

    public TextSpan withEnd(int newEnd) {
        return new TextSpan(docId, revId, start, newEnd, source);
    }

    private boolean sameSpace(TextSpan other) {
        return other != null
                && source == other.source
                && java.util.Objects.equals(docId, other.docId)
                && java.util.Objects.equals(revId, other.revId);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
