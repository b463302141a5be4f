package org.sensiblaw.semantic.model;

import java.util.Comparator;
import java.util.List;

/**
 * Maps page numbers to token ranges. Used for provenance display only; page numbers
 * never feed an identity hash or a diff.
 */
public record PageMap(List<PageRange> ranges) {

    /**
     * @param page  page number as printed by the ingestion collaborator
     * @param start first token index on the page
     * @param end   one past the last token index on the page
     */
    public record PageRange(int page, int start, int end) {}

    private static final PageMap EMPTY = new PageMap(List.of());

    public PageMap {
        ranges = ranges != null
                ? ranges.stream().sorted(Comparator.comparingInt(PageRange::start)
                        .thenComparingInt(PageRange::page)).toList()
                : List.of();
    }

    public static PageMap empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /** Sorted, distinct page numbers whose token range overlaps {@code span}. */
    public List<Integer> pagesFor(TextSpan span) {
        if (span == null || ranges.isEmpty()) return List.of();
        return ranges.stream()
                .filter(r -> r.start() < Math.max(span.end(), span.start() + 1) && span.start() < r.end())
                .map(PageRange::page)
                .distinct()
                .sorted()
                .toList();
    }
}
