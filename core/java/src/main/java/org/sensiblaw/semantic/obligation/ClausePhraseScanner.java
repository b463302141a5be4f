package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.lexicon.PhrasePattern;
import org.sensiblaw.semantic.lexicon.ScopeRule;
import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.model.TextSpan;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scope and lifecycle phrase scanning over one clause. All matching runs on normalized
 * tokens; citation spans are skipped.
 */
final class ClausePhraseScanner {

    private final LegalLexicon lexicon;
    private final TokenStream stream;
    private final List<String> normalized;
    private final List<TextSpan> citations;

    ClausePhraseScanner(LegalLexicon lexicon, TokenStream stream, List<String> normalized, List<TextSpan> citations) {
        this.lexicon = lexicon;
        this.stream = stream;
        this.normalized = normalized;
        this.citations = citations;
    }

    List<ScopeAtom> scopes(int from, int to, String clauseId) {
        List<ScopeAtom> out = new ArrayList<>();
        for (int i = from; i < to; i++) {
            if (insideCitation(i)) continue;
            Map<ScopeCategory, Integer> best = new EnumMap<>(ScopeCategory.class);
            for (ScopeRule rule : lexicon.scopeRules()) {
                int end = scopeEnd(rule, i, to);
                if (end < 0) continue;
                best.merge(ScopeCategory.fromWire(rule.category()), end, Math::max);
            }
            for (Map.Entry<ScopeCategory, Integer> entry : best.entrySet()) {
                TextSpan span = stream.span(i, entry.getValue());
                List<Token> tokens = stream.slice(span);
                out.add(new ScopeAtom(entry.getKey(), TokenNormalizer.surface(tokens),
                        TokenNormalizer.phrase(tokens), span, clauseId));
            }
        }
        return out;
    }

    /** End of the longest scope phrase starting at {@code i}, or -1. */
    int scopeAt(int i, int to) {
        int best = -1;
        for (ScopeRule rule : lexicon.scopeRules()) {
            best = Math.max(best, scopeEnd(rule, i, to));
        }
        return best;
    }

    private int scopeEnd(ScopeRule rule, int i, int to) {
        int p = rule.prefixPattern().endAt(normalized, i);
        if (p < 0 || p > to) return -1;
        if (rule.fixed()) return p;
        int window = Math.min(to, p + lexicon.scopeWindow());
        if (rule.bounded()) {
            for (int q = p; q < window; q++) {
                if (isPunctuation(q)) return -1;
                if (rule.units().contains(normalized.get(q))) return q + 1;
            }
            return -1;
        }
        int q = p;
        while (q < window && !isBoundary(q)) q++;
        return q > p ? q : -1;
    }

    List<LifecycleTrigger> lifecycle(int from, int to, String clauseId) {
        List<LifecycleTrigger> out = new ArrayList<>();
        int i = from;
        while (i < to) {
            if (insideCitation(i)) {
                i++;
                continue;
            }
            Optional<PhrasePattern> activation = LegalLexicon.matchAt(lexicon.activationCues(), normalized, i);
            Optional<PhrasePattern> termination = LegalLexicon.matchAt(lexicon.terminationCues(), normalized, i);
            LifecycleKind kind;
            PhrasePattern cue;
            if (termination.isPresent()
                    && (activation.isEmpty() || termination.get().length() >= activation.get().length())) {
                kind = LifecycleKind.TERMINATION;
                cue = termination.get();
            } else if (activation.isPresent()) {
                kind = LifecycleKind.ACTIVATION;
                cue = activation.get();
            } else {
                i++;
                continue;
            }
            int cueEnd = cue.endAt(normalized, i);
            if (cueEnd > to) break;
            int end = cueEnd;
            while (end < to && end < cueEnd + lexicon.lifecyclePhraseTokens() && !isBoundary(end)) end++;
            TextSpan span = stream.span(i, end);
            List<Token> tokens = stream.slice(span);
            out.add(new LifecycleTrigger(kind, TokenNormalizer.surface(tokens), TokenNormalizer.phrase(tokens),
                    cue.surface(), span, clauseId));
            i = end;
        }
        return out;
    }

    /** True if a lifecycle cue starts at {@code i}. */
    boolean lifecycleCueAt(int i) {
        return LegalLexicon.matchAt(lexicon.activationCues(), normalized, i).isPresent()
                || LegalLexicon.matchAt(lexicon.terminationCues(), normalized, i).isPresent();
    }

    boolean insideCitation(int i) {
        for (TextSpan citation : citations) {
            if (citation.contains(i)) return true;
        }
        return false;
    }

    /** Where an open-ended phrase stops: punctuation, a boundary word, a modal or a marker. */
    boolean isBoundary(int i) {
        return isPunctuation(i)
                || lexicon.objectBoundaries().contains(normalized.get(i))
                || lexicon.modalAt(normalized, i).isPresent()
                || lexicon.markerAt(normalized, i).isPresent();
    }

    boolean isPunctuation(int i) {
        return TokenNormalizer.isPunctuation(stream.get(i));
    }
}
