package org.sensiblaw.semantic.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frozen marker grammar for cross-document edges. Matching is case-insensitive on word
 * boundaries. The patterns are part of the {@code obligation.crossdoc.v2} contract and
 * are not configurable.
 */
public final class CrossDocGrammar {

    private static final Map<EdgeKind, Pattern> MARKERS = new EnumMap<>(EdgeKind.class);

    static {
        MARKERS.put(EdgeKind.REPEALS, marker("repeals?|revokes?|ceases to have effect"));
        MARKERS.put(EdgeKind.MODIFIES, marker("amends?|modif(?:y|ies)|varies|updates"));
        MARKERS.put(EdgeKind.REFERENCES, marker("see|refer to|as provided in|as set out in"));
        MARKERS.put(EdgeKind.CITES, marker("cites?|cited in|as cited in"));
    }

    private static final Pattern FORBIDDEN = marker("conflicts?|overrides?|prevails?|controls?");

    private CrossDocGrammar() {}

    /** One marker occurrence. */
    public record MarkerMatch(EdgeKind kind, String text, int start) {}

    /**
     * First occurrence of each edge kind in {@code text}, ordered by position, then kind.
     * Empty when nothing matches.
     */
    public static List<MarkerMatch> markers(String text) {
        List<MarkerMatch> found = new ArrayList<>();
        if (text == null) return found;
        for (Map.Entry<EdgeKind, Pattern> entry : MARKERS.entrySet()) {
            Matcher m = entry.getValue().matcher(text);
            if (m.find()) {
                found.add(new MarkerMatch(entry.getKey(), m.group(), m.start()));
            }
        }
        found.sort(Comparator.comparingInt(MarkerMatch::start).thenComparing(MarkerMatch::kind));
        return found;
    }

    public static boolean isForbidden(String text) {
        return text != null && FORBIDDEN.matcher(text).find();
    }

    /** The forbidden marker in {@code text}, or {@code null}. */
    public static String forbiddenMarker(String text) {
        if (text == null) return null;
        Matcher m = FORBIDDEN.matcher(text);
        return m.find() ? m.group() : null;
    }

    /** True if {@code text} matches the pattern of {@code kind}. */
    public static boolean matches(EdgeKind kind, String text) {
        Pattern pattern = MARKERS.get(kind);
        return pattern != null && text != null && pattern.matcher(text).find();
    }

    private static Pattern marker(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
