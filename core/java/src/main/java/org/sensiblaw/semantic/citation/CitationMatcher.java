package org.sensiblaw.semantic.citation;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-level citation grammar. Recognises act titles (with optional year, bracketed
 * jurisdiction and trailing provision), bare provisions, medium-neutral citations and
 * law report citations. Overlapping candidates resolve leftmost-longest.
 */
public final class CitationMatcher {

    private static final Set<String> TITLE_CONNECTORS = Set.of("of", "and", "for", "the", "on", "to", "in", "&");
    private static final Set<String> NON_TITLE_STARTS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "under", "in", "if", "unless", "except",
            "see", "subject", "pursuant", "as", "for", "of", "and", "or", "on", "by", "despite",
            "notwithstanding", "where", "when", "while", "upon", "once", "with", "without", "any", "each",
            "every", "no", "all", "section", "part", "division", "schedule", "clause");

    private static final Pattern NUMBER = Pattern.compile("(\\d+[A-Za-z]{0,2})((?:\\([0-9A-Za-z]{1,4}\\))*)");
    private static final Pattern ROMAN = Pattern.compile("[IVXLCDMivxlcdm]+");
    private static final Pattern PINPOINT = Pattern.compile("\\([0-9A-Za-z]{1,4}\\)");
    private static final Pattern PINPOINT_INNER = Pattern.compile("[0-9A-Za-z]{1,4}");
    private static final Pattern COMPACT_PROVISION = Pattern.compile(
            "(ss|s|cl|reg|pt|sch|div|para|art)(\\d+[A-Za-z]{0,2})((?:\\([0-9A-Za-z]{1,4}\\))*)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKETED_YEAR = Pattern.compile("([\\[(])(\\d{4})([\\])])");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern COURT = Pattern.compile("[A-Z][A-Za-z]{1,9}");
    private static final Pattern TITLE_WORD = Pattern.compile("\\p{Lu}[\\p{L}'’&-]*");

    private final LegalLexicon lexicon;

    public CitationMatcher() {
        this(LegalLexicon.defaults());
    }

    public CitationMatcher(LegalLexicon lexicon) {
        this.lexicon = lexicon;
    }

    /** Non-overlapping citations inside {@code [from, to)}, in source order. */
    public List<CitationMatch> match(List<Token> tokens, int from, int to) {
        Scan scan = new Scan(tokens, to);
        List<CitationMatch> found = new ArrayList<>();
        int i = from;
        while (i < to) {
            Optional<CitationMatch> best = scan.longestAt(i);
            if (best.isPresent()) {
                found.add(best.get());
                i = best.get().end();
            } else {
                i++;
            }
        }
        return found;
    }

    /** The citation that spans exactly {@code [from, to)}, if the range holds one. */
    public Optional<CitationMatch> matchExact(List<Token> tokens, int from, int to) {
        return new Scan(tokens, to).longestAt(from).filter(m -> m.end() == to);
    }

    private record Provision(String designator, String number, String pinpoint, int next) {}

    /** Per-call scanning state over one token range. */
    private final class Scan {
        private final List<Token> tokens;
        private final int limit;

        Scan(List<Token> tokens, int limit) {
            this.tokens = tokens;
            this.limit = Math.min(limit, tokens.size());
        }

        Optional<CitationMatch> longestAt(int i) {
            CitationMatch best = null;
            for (CitationMatch candidate : candidates(i)) {
                if (best == null || candidate.end() > best.end()) best = candidate;
            }
            return Optional.ofNullable(best);
        }

        private List<CitationMatch> candidates(int i) {
            List<CitationMatch> out = new ArrayList<>(4);
            neutralCitation(i).ifPresent(out::add);
            lawReport(i).ifPresent(out::add);
            provision(i).ifPresent(out::add);
            act(i).ifPresent(out::add);
            return out;
        }

        // ── Case citations ───────────────────────────────────────────────────

        private Optional<CitationMatch> neutralCitation(int i) {
            int[] year = bracketedYear(i, '[');
            if (year == null) return Optional.empty();
            int j = year[1];
            if (j + 1 >= limit || !COURT.matcher(raw(j)).matches() || !isMostlyUpper(raw(j))
                    || !DIGITS.matcher(raw(j + 1)).matches()) {
                return Optional.empty();
            }
            String work = surface(i, j + 1);
            return Optional.of(new CitationMatch(CitationKind.NEUTRAL_CITATION, i, j + 2,
                    work, null, raw(j + 1), null, surface(i, j + 2)));
        }

        private Optional<CitationMatch> lawReport(int i) {
            int[] year = bracketedYear(i, '(');
            if (year == null) return Optional.empty();
            int j = year[1];
            if (j + 2 >= limit
                    || !DIGITS.matcher(raw(j)).matches()
                    || !COURT.matcher(raw(j + 1)).matches() || !isMostlyUpper(raw(j + 1))
                    || !DIGITS.matcher(raw(j + 2)).matches()) {
                return Optional.empty();
            }
            String work = surface(i, j + 2);
            return Optional.of(new CitationMatch(CitationKind.LAW_REPORT, i, j + 3,
                    work, null, raw(j + 2), null, surface(i, j + 3)));
        }

        /** Returns {year, next index} for {@code [1992]} or {@code [ 1992 ]}. */
        private int[] bracketedYear(int i, char open) {
            if (i >= limit) return null;
            Matcher m = BRACKETED_YEAR.matcher(raw(i));
            if (m.matches() && m.group(1).charAt(0) == open) {
                return new int[]{Integer.parseInt(m.group(2)), i + 1};
            }
            char close = open == '[' ? ']' : ')';
            if (i + 2 < limit && raw(i).equals(String.valueOf(open))
                    && raw(i + 1).matches("\\d{4}") && raw(i + 2).equals(String.valueOf(close))) {
                return new int[]{Integer.parseInt(raw(i + 1)), i + 3};
            }
            return null;
        }

        // ── Provisions ───────────────────────────────────────────────────────

        private Optional<CitationMatch> provision(int i) {
            Provision p = provisionAt(i);
            if (p == null) return Optional.empty();
            int j = p.next;
            // "section 5 of the Crimes Act 1900"
            if (j < limit && norm(j).equals("of")) {
                int k = j + 1;
                if (k < limit && norm(k).equals("the")) k++;
                Optional<CitationMatch> act = act(k);
                if (act.isPresent() && act.get().designator() == null) {
                    CitationMatch a = act.get();
                    return Optional.of(new CitationMatch(CitationKind.ACT, i, a.end(),
                            a.work(), p.designator, p.number, p.pinpoint, surface(i, a.end())));
                }
            }
            return Optional.of(new CitationMatch(CitationKind.PROVISION, i, j,
                    null, p.designator, p.number, p.pinpoint, surface(i, j)));
        }

        private Provision provisionAt(int i) {
            if (i >= limit) return null;
            Matcher compact = COMPACT_PROVISION.matcher(raw(i));
            if (compact.matches()) {
                String designator = lexicon.designators().get(compact.group(1).toLowerCase());
                if (designator != null) {
                    return withPinpoints(designator, compact.group(2), compact.group(3), i + 1);
                }
            }
            String designator = lexicon.designators().get(norm(i));
            if (designator == null) return null;
            int n = i + 1;
            // "s. 5" once the tokenizer has detached the abbreviation's full stop
            if (n < limit && raw(n).equals(".")) n++;
            if (n >= limit) return null;
            String next = raw(n);
            Matcher number = NUMBER.matcher(next);
            if (number.matches()) {
                return withPinpoints(designator, number.group(1), number.group(2), n + 1);
            }
            if (lexicon.romanDesignators().contains(designator) && ROMAN.matcher(next).matches()
                    && next.equals(next.toUpperCase())) {
                return withPinpoints(designator, next, "", n + 1);
            }
            return null;
        }

        private Provision withPinpoints(String designator, String number, String inline, int next) {
            StringBuilder pinpoint = new StringBuilder(inline == null ? "" : inline);
            int j = next;
            while (j < limit) {
                if (PINPOINT.matcher(raw(j)).matches()) {
                    pinpoint.append(raw(j));
                    j++;
                } else if (j + 2 < limit && raw(j).equals("(")
                        && PINPOINT_INNER.matcher(raw(j + 1)).matches() && raw(j + 2).equals(")")) {
                    pinpoint.append('(').append(raw(j + 1)).append(')');
                    j += 3;
                } else {
                    break;
                }
            }
            return new Provision(designator, number, pinpoint.length() > 0 ? pinpoint.toString() : null, j);
        }

        // ── Acts ─────────────────────────────────────────────────────────────

        private Optional<CitationMatch> act(int i) {
            if (i >= limit || !isTitleWord(i) || NON_TITLE_STARTS.contains(norm(i))
                    || lexicon.modalAt(normalizedWindow(i), 0).isPresent()) {
                return Optional.empty();
            }
            int j = i;
            int lastInstrument = -1;
            while (j < limit) {
                if (isTitleWord(j)) {
                    if (lexicon.instrumentWords().contains(norm(j))) lastInstrument = j;
                    j++;
                } else if (j > i && TITLE_CONNECTORS.contains(norm(j)) && j + 1 < limit && isTitleWord(j + 1)) {
                    j++;
                } else {
                    break;
                }
            }
            if (lastInstrument < 0) return Optional.empty();
            int end = lastInstrument + 1;
            int[] year = yearAt(end);
            if (year != null) end = year[1];
            int jurisdictionEnd = jurisdictionAt(end);
            if (jurisdictionEnd > end) end = jurisdictionEnd;
            boolean qualified = end > lastInstrument + 1;
            if (lastInstrument == i && !qualified) {
                return Optional.empty();
            }
            String work = surface(i, end);
            Provision trailing = provisionAt(end);
            if (trailing != null) {
                return Optional.of(new CitationMatch(CitationKind.ACT, i, trailing.next, work,
                        trailing.designator, trailing.number, trailing.pinpoint, surface(i, trailing.next)));
            }
            return Optional.of(new CitationMatch(CitationKind.ACT, i, end, work, null, null, null, work));
        }

        /**
         * Year after a title; also accepts OCR-split digits such as {@code 19 00}.
         * Returns {year, next index} or {@code null}.
         */
        private int[] yearAt(int i) {
            StringBuilder digits = new StringBuilder();
            int j = i;
            while (j < limit && j < i + 3 && DIGITS.matcher(raw(j)).matches() && digits.length() < 4) {
                digits.append(raw(j));
                j++;
            }
            if (digits.length() != 4) return null;
            int year = Integer.parseInt(digits.toString());
            return year >= 1200 && year <= 2199 ? new int[]{year, j} : null;
        }

        /** Index after a bracketed jurisdiction such as {@code (NSW)} or {@code ( New South Wales )}, else {@code i}. */
        private int jurisdictionAt(int i) {
            if (i >= limit || !raw(i).startsWith("(")) return i;
            StringBuilder inner = new StringBuilder();
            for (int j = i; j < limit && j < i + 6; j++) {
                inner.append(' ').append(raw(j));
                if (raw(j).endsWith(")")) {
                    String key = inner.toString().replace(".", "").replaceAll("[()]", " ").trim().replaceAll("\\s+", " ").toLowerCase();
                    return lexicon.jurisdictions().containsKey(key) ? j + 1 : i;
                }
            }
            return i;
        }

        // ── Token helpers ────────────────────────────────────────────────────

        private boolean isTitleWord(int j) {
            return TITLE_WORD.matcher(raw(j)).matches();
        }

        private List<String> normalizedWindow(int i) {
            return TokenNormalizer.normalizeAll(tokens.subList(i, Math.min(limit, i + 3)));
        }

        private String raw(int j) {
            return tokens.get(j).text();
        }

        private String norm(int j) {
            return TokenNormalizer.normalize(tokens.get(j));
        }

        private String surface(int from, int to) {
            return TokenNormalizer.surface(tokens.subList(from, to));
        }

        private boolean isMostlyUpper(String s) {
            long upper = s.chars().filter(Character::isUpperCase).count();
            return upper * 2 > s.length();
        }
    }
}
