package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.citation.CitationMatch;
import org.sensiblaw.semantic.citation.CitationMatcher;
import org.sensiblaw.semantic.identity.IdentityHashing;
import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.lexicon.PhrasePattern;
import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.model.TextSpan;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link LogicTree} from a token stream.
 *
 * <p>Clauses come from sentence boundaries, {@code ;} tokens, and coordinating
 * conjunctions that join two modal-bearing segments. Inside a clause, modal triggers
 * become MODAL nodes, condition and exception markers open CONDITION and EXCEPTION
 * sub-spans, and citations become REFERENCE nodes. Matching runs on normalized tokens
 * only, so spacing and punctuation noise cannot move a node.
 */
public class LogicTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(LogicTreeBuilder.class);

    private static final Set<String> CLAUSE_PUNCTUATION = Set.of(".", ";", ":", "?", "!");

    private final LegalLexicon lexicon;
    private final CitationMatcher citations;

    public LogicTreeBuilder() {
        this(LegalLexicon.defaults());
    }

    public LogicTreeBuilder(LegalLexicon lexicon) {
        this.lexicon = lexicon;
        this.citations = new CitationMatcher(lexicon);
    }

    public LogicTree build(TokenStream stream) {
        return build(stream, false);
    }

    /**
     * @param includeTokens when true, tokens not covered by a structural node become TOKEN leaves
     */
    public LogicTree build(TokenStream stream, boolean includeTokens) {
        List<String> normalized = TokenNormalizer.normalizeAll(stream.tokens());
        Draft root = new Draft(NodeType.ROOT, 0, stream.size(), null);

        for (TextSpan sentence : stream.sentenceSpans()) {
            List<CitationMatch> refs = citations.match(stream.tokens(), sentence.start(), sentence.end());
            List<Cue> cues = scanCues(normalized, sentence.start(), sentence.end(), refs);
            for (int[] range : segment(stream.tokens(), normalized, sentence.start(), sentence.end(), refs, cues)) {
                root.children.add(clause(stream, range[0], range[1], refs, cues));
            }
        }
        if (includeTokens) {
            for (Draft clause : root.children) {
                addTokenLeaves(clause);
            }
        }

        List<LogicNode> nodes = new ArrayList<>();
        List<LogicEdge> edges = new ArrayList<>();
        String rootId = emit(root, stream, nodes, edges);
        LogicTree tree = new LogicTree(stream, rootId, nodes, edges);
        log.debug("Built {} for {}@{}: {} clauses, {} nodes",
                LogicTree.VERSION, stream.docId(), stream.revId(), root.children.size(), nodes.size());
        return tree;
    }

    /** Deterministic node id: a function of document, revision, type and span only. */
    public static String nodeId(String docId, String revId, NodeType type, int start, int end) {
        String hash = IdentityHashing.hashParts(docId, revId, type.name(), Integer.toString(start), Integer.toString(end));
        return "n" + hash.substring(0, 16);
    }

    // ── Cue scanning ─────────────────────────────────────────────────────────

    private enum CueKind { MODAL, CONDITION, EXCEPTION, DEPENDENCY }

    private record Cue(CueKind kind, int start, int end, PhrasePattern pattern) {
        int length() {
            return end - start;
        }
    }

    /** Leftmost-longest scan for modal, marker and dependency cues, skipping citation spans. */
    private List<Cue> scanCues(List<String> normalized, int from, int to, List<CitationMatch> refs) {
        List<Cue> cues = new ArrayList<>();
        int i = from;
        int r = 0;
        while (i < to) {
            while (r < refs.size() && refs.get(r).end() <= i) r++;
            if (r < refs.size() && refs.get(r).start() <= i) {
                i = refs.get(r).end();
                continue;
            }
            int limit = r < refs.size() ? refs.get(r).start() : to;
            final int at = i;
            // a cue never reaches past the sentence or into a citation
            List<String> window = normalized.subList(0, limit);
            Cue best = null;
            best = longer(best, lexicon.modalAt(window, at)
                    .map(p -> new Cue(CueKind.MODAL, at, p.endAt(window, at), p)));
            best = longer(best, lexicon.markerAt(window, at).map(p -> new Cue(
                    lexicon.isExceptionTag(p.tag()) ? CueKind.EXCEPTION : CueKind.CONDITION, at, p.endAt(window, at), p)));
            best = longer(best, lexicon.dependencyMarkerAt(window, at)
                    .map(p -> new Cue(CueKind.DEPENDENCY, at, p.endAt(window, at), p)));
            if (best != null && best.end() <= limit) {
                cues.add(best);
                i = best.end();
            } else {
                i++;
            }
        }
        return cues;
    }

    private static Cue longer(Cue current, Optional<Cue> candidate) {
        if (candidate.isEmpty()) return current;
        if (current == null || candidate.get().length() > current.length()) return candidate.get();
        return current;
    }

    // ── Clause segmentation ──────────────────────────────────────────────────

    private List<int[]> segment(List<Token> tokens, List<String> normalized, int from, int to,
                                List<CitationMatch> refs, List<Cue> cues) {
        List<int[]> clauses = new ArrayList<>();
        int depth = 0;
        int segmentStart = from;
        List<Integer> coordinators = new ArrayList<>();
        for (int i = from; i < to; i++) {
            depth = Math.max(0, depth + bracketDelta(tokens.get(i).text()));
            if (depth > 0 || insideReference(i, refs)) continue;
            String raw = tokens.get(i).text();
            if (raw.equals(";") && i + 1 < to) {
                splitOnCoordinators(segmentStart, i + 1, coordinators, cues, clauses);
                segmentStart = i + 1;
                coordinators.clear();
            } else if (i > segmentStart && lexicon.clauseSeparators().contains(normalized.get(i))) {
                coordinators.add(i);
            }
        }
        if (depth > 0) {
            log.warn("Unbalanced bracket in sentence [{}, {}); closed at clause end", from, to);
        }
        splitOnCoordinators(segmentStart, to, coordinators, cues, clauses);
        return clauses;
    }

    /** A coordinator splits only when the text on both sides carries its own modal trigger. */
    private void splitOnCoordinators(int from, int to, List<Integer> coordinators, List<Cue> cues, List<int[]> out) {
        if (from >= to) return;
        List<Integer> bounds = new ArrayList<>();
        bounds.add(from);
        bounds.addAll(coordinators);
        bounds.add(to);
        int currentStart = bounds.get(0);
        int currentEnd = bounds.get(1);
        for (int k = 1; k + 1 < bounds.size(); k++) {
            int nextStart = bounds.get(k);
            int nextEnd = bounds.get(k + 1);
            if (hasModal(cues, currentStart, currentEnd) && hasModal(cues, nextStart, nextEnd)) {
                out.add(new int[]{currentStart, currentEnd});
                currentStart = nextStart;
            }
            currentEnd = nextEnd;
        }
        out.add(new int[]{currentStart, currentEnd});
    }

    private static boolean hasModal(List<Cue> cues, int from, int to) {
        return cues.stream().anyMatch(c -> c.kind() == CueKind.MODAL && c.start() >= from && c.start() < to);
    }

    private static boolean insideReference(int i, List<CitationMatch> refs) {
        return refs.stream().anyMatch(r -> r.start() < i && i < r.end());
    }

    private static int bracketDelta(String text) {
        int delta = 0;
        for (char c : text.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') delta++;
            if (c == ')' || c == ']' || c == '}') delta--;
        }
        return delta;
    }

    // ── Clause contents ──────────────────────────────────────────────────────

    private Draft clause(TokenStream stream, int start, int end, List<CitationMatch> allRefs, List<Cue> allCues) {
        List<Token> tokens = stream.tokens();
        Draft clause = new Draft(NodeType.CLAUSE, start, end, clauseLabel(tokens, start, end));
        int contentEnd = end;
        while (contentEnd > start && CLAUSE_PUNCTUATION.contains(tokens.get(contentEnd - 1).text())) contentEnd--;

        List<CitationMatch> refs = allRefs.stream().filter(r -> r.start() >= start && r.end() <= end).toList();
        List<Cue> cues = allCues.stream().filter(c -> c.start() >= start && c.end() <= end).toList();
        int firstModal = cues.stream().filter(c -> c.kind() == CueKind.MODAL)
                .mapToInt(Cue::start).min().orElse(Integer.MAX_VALUE);

        List<Draft> candidates = new ArrayList<>();
        for (Cue cue : cues) {
            switch (cue.kind()) {
                case MODAL -> candidates.add(new Draft(NodeType.MODAL, cue.start(), cue.end(), cue.pattern().tag()));
                case CONDITION, EXCEPTION -> {
                    int markerEnd = markerSpanEnd(tokens, cue, cues, refs, contentEnd, firstModal);
                    NodeType type = cue.kind() == CueKind.CONDITION ? NodeType.CONDITION : NodeType.EXCEPTION;
                    candidates.add(new Draft(type, cue.start(), markerEnd, cue.pattern().tag()));
                }
                case DEPENDENCY -> {
                    // dependency phrases stay in the clause text; the graph projector reads them
                }
            }
        }
        for (CitationMatch ref : refs) {
            candidates.add(new Draft(NodeType.REFERENCE, ref.start(), ref.end(), ref.kind().wireName()));
        }
        nest(clause, candidates, stream);

        String quotes = TokenNormalizer.surface(tokens.subList(start, end));
        if (quotes.chars().filter(c -> c == '"').count() % 2 != 0) {
            log.warn("Unbalanced quote in clause [{}, {}) of {}@{}; closed at clause end",
                    start, end, stream.docId(), stream.revId());
        }
        return clause;
    }

    /**
     * A marker's sub-span runs to the nearest of: the clause content end, the next marker,
     * the first comma with content before it, and (for a marker ahead of every modal) the
     * first modal. A comma-closed marker keeps the modals before its comma when another
     * modal follows it, as in "If a licence is required, the holder must renew it". An end
     * that falls inside a citation moves to the citation's end.
     */
    private static int markerSpanEnd(List<Token> tokens, Cue marker, List<Cue> cues, List<CitationMatch> refs,
                                     int contentEnd, int firstModal) {
        int end = contentEnd;
        for (Cue other : cues) {
            if ((other.kind() == CueKind.CONDITION || other.kind() == CueKind.EXCEPTION)
                    && other.start() >= marker.end()) {
                end = Math.min(end, other.start());
                break;
            }
        }
        int comma = -1;
        int depth = 0;
        for (int i = marker.end(); i < end; i++) {
            String text = tokens.get(i).text();
            depth = Math.max(0, depth + bracketDelta(text));
            if (depth == 0 && text.equals(",") && i > marker.end()) {
                comma = i;
                break;
            }
        }
        if (comma >= 0) end = comma;
        boolean modalAfterComma = false;
        for (Cue other : cues) {
            if (comma >= 0 && other.kind() == CueKind.MODAL && other.start() > comma) modalAfterComma = true;
        }
        if (marker.start() < firstModal && firstModal >= marker.end() && !modalAfterComma) {
            end = Math.min(end, firstModal);
        }
        for (CitationMatch ref : refs) {
            if (ref.start() < end && end < ref.end()) end = ref.end();
        }
        return Math.max(end, marker.end());
    }

    private static String clauseLabel(List<Token> tokens, int start, int end) {
        if (start >= end) return null;
        List<Token> clauseTokens = tokens.subList(start, end);
        if (!TokenNormalizer.isNumbering(clauseTokens, 0)) return null;
        String label = TokenNormalizer.normalize(clauseTokens.get(0));
        return label.isEmpty() ? null : label;
    }

    /**
     * Greedy containment nesting. Candidates are taken by span start, longest first;
     * a candidate that partially overlaps an earlier one is dropped.
     */
    private static void nest(Draft clause, List<Draft> candidates, TokenStream stream) {
        candidates.sort(Comparator.comparingInt((Draft d) -> d.start)
                .thenComparing(Comparator.comparingInt((Draft d) -> d.end).reversed())
                .thenComparing(d -> d.type));
        Deque<Draft> open = new ArrayDeque<>();
        open.push(clause);
        for (Draft candidate : candidates) {
            while (open.peek() != clause && open.peek().end <= candidate.start) open.pop();
            Draft parent = open.peek();
            Draft previous = parent.children.isEmpty() ? null : parent.children.get(parent.children.size() - 1);
            boolean contained = parent.start <= candidate.start && candidate.end <= parent.end;
            if (!contained || previous != null && previous.end > candidate.start) {
                log.debug("Dropped overlapping {} [{}, {}) in {}@{}",
                        candidate.type, candidate.start, candidate.end, stream.docId(), stream.revId());
                continue;
            }
            parent.children.add(candidate);
            if (candidate.type.isContainer()) open.push(candidate);
        }
    }

    private static void addTokenLeaves(Draft container) {
        List<Draft> merged = new ArrayList<>();
        int cursor = container.start;
        for (Draft child : container.children) {
            for (int i = cursor; i < child.start; i++) merged.add(new Draft(NodeType.TOKEN, i, i + 1, null));
            if (child.type.isContainer()) addTokenLeaves(child);
            merged.add(child);
            cursor = child.end;
        }
        for (int i = cursor; i < container.end; i++) merged.add(new Draft(NodeType.TOKEN, i, i + 1, null));
        container.children.clear();
        container.children.addAll(merged);
    }

    // ── Emission ─────────────────────────────────────────────────────────────

    private static String emit(Draft draft, TokenStream stream, List<LogicNode> nodes, List<LogicEdge> edges) {
        String id = nodeId(stream.docId(), stream.revId(), draft.type, draft.start, draft.end);
        int slot = nodes.size();
        nodes.add(null);
        List<String> childIds = new ArrayList<>(draft.children.size());
        List<LogicEdge> childEdges = new ArrayList<>();
        for (Draft child : draft.children) {
            String childId = emit(child, stream, nodes, childEdges);
            childIds.add(childId);
        }
        for (String childId : childIds) {
            edges.add(new LogicEdge(EdgeType.STRUCTURAL, id, childId));
        }
        for (int i = 1; i < childIds.size(); i++) {
            edges.add(new LogicEdge(EdgeType.SEQUENCE, childIds.get(i - 1), childIds.get(i)));
        }
        edges.addAll(childEdges);
        TextSpan span = stream.span(draft.start, draft.end);
        nodes.set(slot, new LogicNode(id, draft.type, span, stream.text(span), draft.label, childIds));
        return id;
    }

    /** Mutable node under construction. */
    private static final class Draft {
        final NodeType type;
        final int start;
        final int end;
        final String label;
        final List<Draft> children = new ArrayList<>();

        Draft(NodeType type, int start, int end, String label) {
            this.type = type;
            this.start = start;
            this.end = end;
            this.label = label;
        }
    }
}
