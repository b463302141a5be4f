package org.sensiblaw.semantic.citation;

/**
 * One citation found in a token range.
 *
 * @param kind       surface shape
 * @param start      first token index (inclusive)
 * @param end        last token index (exclusive)
 * @param work       instrument or report surface text including year and bracketed jurisdiction,
 *                   {@code null} for a bare provision
 * @param designator canonical designator word ({@code section}, {@code part}, ...), or {@code null}
 * @param number     provision number as written ({@code 5}, {@code IV}, {@code 4A}), or the
 *                   report page / judgment number, or {@code null}
 * @param pinpoint   bracketed sub-provision suffix such as {@code (2)(a)}, or {@code null}
 * @param text       surface text of the whole match
 */
public record CitationMatch(
        CitationKind kind,
        int start,
        int end,
        String work,
        String designator,
        String number,
        String pinpoint,
        String text
) {
    public int length() {
        return end - start;
    }

    /** {@code designator number}, the bare number when there is no designator, or {@code null}. */
    public String section() {
        if (number == null) return null;
        return designator != null ? designator + " " + number : number;
    }

    public boolean isInternal() {
        return kind == CitationKind.PROVISION && work == null;
    }
}
