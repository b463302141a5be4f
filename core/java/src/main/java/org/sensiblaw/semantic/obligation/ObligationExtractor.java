package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.citation.CitationMatch;
import org.sensiblaw.semantic.citation.CitationMatcher;
import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.logic.LogicNode;
import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.logic.NodeType;
import org.sensiblaw.semantic.model.TextSpan;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;
import org.sensiblaw.semantic.reference.CrIdV1;
import org.sensiblaw.semantic.reference.ReferenceCanonicalizer;
import org.sensiblaw.semantic.reference.ReferenceExtractor;
import org.sensiblaw.semantic.reference.ReferenceIdentities;
import org.sensiblaw.semantic.reference.ReferenceIdentity;
import org.sensiblaw.semantic.reference.ReferenceIdentityScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads {@link ObligationAtom}s from the clauses of a logic tree.
 *
 * <p>Every field of an atom comes from the tokens of one CLAUSE: the governing MODAL
 * nodes directly under the clause open atoms, the clause's CONDITION and EXCEPTION
 * nodes become conditions, and only the REFERENCE nodes inside the clause contribute
 * reference identities. A clause without a modal yields nothing; a modal whose actor
 * or action cannot be read still yields an atom with those fields {@code null}.
 */
public class ObligationExtractor {

    private static final Logger log = LoggerFactory.getLogger(ObligationExtractor.class);

    private static final Set<String> ACTOR_STOPS = Set.of(",", ";", ":");
    private static final Set<String> OPENING_QUOTES = Set.of("\"", "“");
    private static final Set<String> CLOSING_QUOTES = Set.of("\"", "”");

    private final LegalLexicon lexicon;
    private final ReferenceExtractor referenceExtractor;
    private final ReferenceIdentityScheme referenceScheme;
    private final CitationMatcher citations;
    private final ReferenceCanonicalizer canonicalizer;

    public ObligationExtractor() {
        this(LegalLexicon.defaults(), new CrIdV1());
    }

    public ObligationExtractor(LegalLexicon lexicon, ReferenceIdentityScheme referenceScheme) {
        this.lexicon = lexicon;
        this.referenceExtractor = new ReferenceExtractor(lexicon);
        this.referenceScheme = referenceScheme;
        this.citations = new CitationMatcher(lexicon);
        this.canonicalizer = new ReferenceCanonicalizer(lexicon);
    }

    public List<ObligationAtom> extract(LogicTree tree) {
        return extract(tree, ExtractionConfig.defaults());
    }

    public List<ObligationAtom> extract(LogicTree tree, ExtractionConfig config) {
        List<ReferenceIdentity> identities =
                ReferenceIdentities.identify(referenceExtractor.extract(tree), referenceScheme);
        return extract(tree, identities, config);
    }

    /**
     * @param identities CR-IDs of the tree's references; each is bound through the REFERENCE
     *                   node named in its provenance
     */
    public List<ObligationAtom> extract(LogicTree tree, List<ReferenceIdentity> identities, ExtractionConfig config) {
        Map<String, String> hashByAnchor = new HashMap<>();
        for (ReferenceIdentity identity : identities) {
            if (identity.provenance() != null && identity.provenance().anchorUsed() != null) {
                hashByAnchor.put(identity.provenance().anchorUsed(), identity.identityHash());
            }
        }
        List<String> normalized = TokenNormalizer.normalizeAll(tree.stream().tokens());
        List<ObligationAtom> atoms = new ArrayList<>();
        List<LogicNode> clauses = tree.clauses();
        for (int index = 0; index < clauses.size(); index++) {
            new ClauseReader(tree, clauses.get(index), index, normalized, hashByAnchor, config).read(atoms);
        }
        log.info("Extracted {} obligations from {} clauses of {}@{}",
                atoms.size(), clauses.size(), tree.docId(), tree.revId());
        return atoms;
    }

    /** Binding state for a single clause. */
    private final class ClauseReader {
        private final LogicTree tree;
        private final TokenStream stream;
        private final LogicNode clause;
        private final int clauseIndex;
        private final List<String> normalized;
        private final Map<String, String> hashByAnchor;
        private final ExtractionConfig config;
        private final List<LogicNode> markers = new ArrayList<>();
        private final List<LogicNode> modals = new ArrayList<>();
        private final List<LogicNode> references;
        private final ClausePhraseScanner scanner;
        private final int contentEnd;

        ClauseReader(LogicTree tree, LogicNode clause, int clauseIndex, List<String> normalized,
                     Map<String, String> hashByAnchor, ExtractionConfig config) {
            this.tree = tree;
            this.stream = tree.stream();
            this.clause = clause;
            this.clauseIndex = clauseIndex;
            this.normalized = normalized;
            this.hashByAnchor = hashByAnchor;
            this.config = config;
            for (LogicNode child : tree.children(clause)) {
                switch (child.type()) {
                    case MODAL -> modals.add(child);
                    case CONDITION, EXCEPTION -> markers.add(child);
                    default -> { }
                }
            }
            this.references = tree.descendants(clause, NodeType.REFERENCE);
            this.scanner = new ClausePhraseScanner(lexicon, stream, normalized,
                    references.stream().map(LogicNode::span).toList());
            int end = clause.span().end();
            while (end > clause.span().start() && scanner.isPunctuation(end - 1)) end--;
            // a closing bracket of "( NSW )" belongs to the citation
            for (LogicNode reference : references) {
                if (reference.span().start() < end && end < reference.span().end()) end = reference.span().end();
            }
            this.contentEnd = end;
        }

        void read(List<ObligationAtom> out) {
            if (modals.isEmpty()) {
                log.debug("No modal trigger in clause {} of {}@{}", clause.id(), tree.docId(), tree.revId());
                return;
            }
            int start = clause.span().start();
            List<ConditionAtom> conditions = markers.stream().map(this::condition).toList();
            List<ScopeAtom> scopes = scanner.scopes(start, contentEnd, clause.id());
            List<LifecycleTrigger> lifecycle = scanner.lifecycle(start, contentEnd, clause.id());
            List<String> referenceIdentities = references.stream()
                    .map(n -> hashByAnchor.get(n.id()))
                    .filter(Objects::nonNull)
                    .distinct()
                    .toList();
            List<Integer> pages = stream.pageMap().pagesFor(clause.span());

            PhraseAtom previousActor = null;
            int regionStart = start;
            for (LogicNode modal : modals) {
                ObligationType type = ObligationType.fromTag(modal.label());
                String modality = TokenNormalizer.phrase(stream.slice(modal.span()));
                PhraseAtom actor = null;
                if (config.enableActorBinding()) {
                    actor = actor(regionStart, modal.span().start());
                    if (actor == null && onlyJoinersBetween(regionStart, modal.span().start())) actor = previousActor;
                    previousActor = actor;
                }
                List<PhraseAtom[]> bindings = new ArrayList<>();
                int bindingEnd = modal.span().end();
                if (config.enableActionBinding()) {
                    bindingEnd = actionsAndObjects(type, modal.span().end(), bindings);
                }
                if (bindings.isEmpty()) bindings.add(new PhraseAtom[]{null, null});
                ObligationProvenance provenance = new ObligationProvenance(tree.docId(), tree.revId(),
                        clauseIndex, clause.label(), pages, modal.id());
                for (PhraseAtom[] binding : bindings) {
                    out.add(new ObligationAtom(type, modality, clause.id(), actor, binding[0], binding[1],
                            conditions, scopes, lifecycle, referenceIdentities, clause.span(), provenance));
                }
                log.debug("Clause {}: {} '{}' actor={} bindings={}",
                        clause.id(), type.wireName(), modality, actor != null ? actor.normalized() : null, bindings.size());
                regionStart = Math.max(regionStart, bindingEnd);
            }
        }

        private ConditionAtom condition(LogicNode marker) {
            ConditionType type = ConditionType.fromTag(marker.label());
            int start = marker.span().start();
            int cueEnd = lexicon.markerAt(normalized, start).map(p -> p.endAt(normalized, start)).orElse(start + 1);
            int bodyStart = Math.min(marker.span().end(), cueEnd);
            List<Token> body = stream.tokens().subList(bodyStart, marker.span().end());
            return new ConditionAtom(type, TokenNormalizer.surface(body), TokenNormalizer.phrase(body),
                    marker.span(), clause.id());
        }

        /** True if nothing but punctuation and coordinators lies in {@code [from, to)}. */
        private boolean onlyJoinersBetween(int from, int to) {
            for (int i = from; i < to; i++) {
                if (!scanner.isPunctuation(i) && !lexicon.clauseSeparators().contains(normalized.get(i))) return false;
            }
            return true;
        }

        /**
         * Subject phrase before the modal: back to the nearest comma, coordinator, marker
         * or earlier binding, with list numbering and punctuation dropped.
         */
        private PhraseAtom actor(int regionStart, int modalStart) {
            int from = modalStart;
            while (from > regionStart) {
                int i = from - 1;
                if (ACTOR_STOPS.contains(stream.get(i).text())
                        || lexicon.clauseSeparators().contains(normalized.get(i))
                        || insideMarker(i)) {
                    break;
                }
                from = i;
            }
            List<Token> clauseTokens = stream.tokens().subList(clause.span().start(), clause.span().end());
            int first = -1;
            int last = -1;
            for (int i = from; i < modalStart; i++) {
                if (scanner.isPunctuation(i)
                        || TokenNormalizer.isNumbering(clauseTokens, i - clause.span().start())) {
                    continue;
                }
                if (first < 0) first = i;
                last = i;
            }
            if (first < 0) return null;
            return phrase(first, last + 1);
        }

        /**
         * Action head and object after the modal. A coordinator followed by a verb starts a
         * further action with its own object, so one clause can yield several atoms.
         *
         * @return index after the last bound token
         */
        private int actionsAndObjects(ObligationType type, int modalEnd, List<PhraseAtom[]> out) {
            int j = skipLeadIn(modalEnd);
            if (j < contentEnd && normalized.get(j).equals("to")) j = skipLeadIn(j + 1);
            if (j >= contentEnd || isStop(j)) return j;

            if (type == ObligationType.EXCLUSION) {
                int end = objectEnd(j);
                if (end < contentEnd && modalStartsAt(end)) {
                    // "except that a licensee may sell it": the run is the next modal's subject
                    out.add(new PhraseAtom[]{null, null});
                    return j;
                }
                out.add(new PhraseAtom[]{null, end > j ? phrase(j, end) : null});
                return end;
            }
            while (j < contentEnd) {
                PhraseAtom action = phrase(j, j + 1);
                int objectStart = j + 1;
                int end = objectEnd(objectStart);
                out.add(new PhraseAtom[]{action, end > objectStart ? phrase(objectStart, end) : null});
                if (end + 1 < contentEnd && lexicon.clauseSeparators().contains(normalized.get(end))
                        && stream.get(end + 1).isVerb()) {
                    j = end + 1;
                    continue;
                }
                return end;
            }
            return j;
        }

        /**
         * Skips punctuation, scope phrases and condition or exception sub-spans between a
         * modal and its verb: "must, within 7 days, notify", "must not, unless licensed, sell".
         */
        private int skipLeadIn(int j) {
            while (j < contentEnd) {
                if (scanner.isPunctuation(j)) {
                    j++;
                    continue;
                }
                LogicNode marker = markerStartingAt(j);
                if (marker != null) {
                    j = marker.span().end();
                    continue;
                }
                int scopeEnd = scanner.scopeAt(j, contentEnd);
                if (scopeEnd > j) {
                    j = scopeEnd;
                    continue;
                }
                break;
            }
            return j;
        }

        private int objectEnd(int start) {
            int t = start;
            int quoteEnd = -1;
            while (t < contentEnd) {
                LogicNode citation = citationAt(t);
                if (citation != null) {
                    t = citation.span().end();
                    continue;
                }
                int close = closingQuote(t);
                if (close > t) {
                    t = close + 1;
                    quoteEnd = t;
                    continue;
                }
                if (isStop(t)
                        || lexicon.objectBoundaries().contains(normalized.get(t))
                        || scanner.scopeAt(t, contentEnd) > t
                        || scanner.lifecycleCueAt(t)
                        || lexicon.dependencyMarkerAt(normalized, t).isPresent()
                        || lexicon.clauseSeparators().contains(normalized.get(t))
                        && t + 1 < contentEnd && stream.get(t + 1).isVerb()) {
                    break;
                }
                t++;
            }
            // a quoted run may close on the clause's last token
            return Math.max(Math.min(t, contentEnd), quoteEnd);
        }

        /** Index of the quote closing one that opens at {@code i}, or -1. */
        private int closingQuote(int i) {
            if (!OPENING_QUOTES.contains(stream.get(i).text())) return -1;
            for (int k = i + 1; k < clause.span().end(); k++) {
                if (CLOSING_QUOTES.contains(stream.get(k).text())) return k;
            }
            return -1;
        }

        private boolean isStop(int i) {
            return scanner.isPunctuation(i) || markerStartsAt(i) || modalStartsAt(i);
        }

        private boolean markerStartsAt(int i) {
            return markerStartingAt(i) != null;
        }

        private LogicNode markerStartingAt(int i) {
            for (LogicNode marker : markers) {
                if (marker.span().start() == i) return marker;
            }
            return null;
        }

        private boolean modalStartsAt(int i) {
            return modals.stream().anyMatch(m -> m.span().start() == i);
        }

        private boolean insideMarker(int i) {
            return markers.stream().anyMatch(m -> m.span().contains(i));
        }

        private LogicNode citationAt(int i) {
            for (LogicNode reference : references) {
                if (reference.span().start() == i) return reference;
            }
            return null;
        }

        /** Surface text as written; normalized text with each embedded citation in canonical form. */
        private PhraseAtom phrase(int from, int to) {
            TextSpan span = stream.span(from, to);
            List<Token> tokens = stream.slice(span);
            List<String> parts = new ArrayList<>();
            int i = from;
            while (i < to) {
                LogicNode citation = citationAt(i);
                if (citation != null && citation.span().end() <= to) {
                    parts.add(canonicalCitation(citation));
                    i = citation.span().end();
                    continue;
                }
                String n = normalized.get(i);
                if (!n.isEmpty()) parts.add(n);
                i++;
            }
            String normalizedPhrase = String.join(" ", parts).strip();
            if (normalizedPhrase.isEmpty()) return null;
            return new PhraseAtom(TokenNormalizer.surface(tokens), normalizedPhrase, span, clause.id());
        }

        /** "section 5 of the Crimes Act 19 00 ( NSW )" and "Crimes Act 1900 (NSW) s 5" read the same. */
        private String canonicalCitation(LogicNode reference) {
            TextSpan span = reference.span();
            Optional<CitationMatch> found = citations.matchExact(stream.tokens(), span.start(), span.end());
            if (found.isEmpty()) return TokenNormalizer.phrase(stream.slice(span));
            CitationMatch match = found.get();
            List<String> parts = new ArrayList<>();
            if (match.designator() != null) {
                parts.add(canonicalizer.canonicalSection(match.designator() + " " + match.number()));
            } else if (match.number() != null) {
                parts.add(canonicalizer.canonicalNumber(null, match.number()));
            }
            if (match.pinpoint() != null) parts.add(canonicalizer.canonicalPinpoint(match.pinpoint()));
            if (match.work() != null) {
                parts.add(canonicalizer.workFamily(match.work()).replace('-', ' '));
                Integer year = canonicalizer.year(match.work());
                if (year != null) parts.add(year.toString());
                String jurisdiction = canonicalizer.jurisdiction(match.work());
                if (jurisdiction != null) parts.add(jurisdiction);
            }
            return String.join(" ", parts);
        }
    }
}
