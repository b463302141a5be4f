package org.sensiblaw.semantic.lexicon;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lexical tables: modal phrases, condition and exception markers, scope and
 * lifecycle cues, citation vocabulary. Pattern lists are kept longest-first so that a
 * scan picks the leftmost-longest match.
 */
public final class LegalLexicon {

    private final String version;
    private final List<PhrasePattern> modals;
    private final List<PhrasePattern> conditionMarkers;
    private final List<PhrasePattern> exceptionMarkers;
    private final List<PhrasePattern> dependencyMarkers;
    private final Set<String> clauseSeparators;
    private final Set<String> objectBoundaries;
    private final Set<String> abbreviations;
    private final List<ScopeRule> scopeRules;
    private final int scopeWindow;
    private final List<PhrasePattern> activationCues;
    private final List<PhrasePattern> terminationCues;
    private final int lifecyclePhraseTokens;
    private final Set<String> instrumentWords;
    private final Map<String, String> designators;
    private final Set<String> romanDesignators;
    private final Map<String, String> jurisdictions;

    LegalLexicon(
            String version,
            List<PhrasePattern> modals,
            List<PhrasePattern> conditionMarkers,
            List<PhrasePattern> exceptionMarkers,
            List<PhrasePattern> dependencyMarkers,
            Set<String> clauseSeparators,
            Set<String> objectBoundaries,
            Set<String> abbreviations,
            List<ScopeRule> scopeRules,
            int scopeWindow,
            List<PhrasePattern> activationCues,
            List<PhrasePattern> terminationCues,
            int lifecyclePhraseTokens,
            Set<String> instrumentWords,
            Map<String, String> designators,
            Set<String> romanDesignators,
            Map<String, String> jurisdictions
    ) {
        this.version = version;
        this.modals = longestFirst(modals);
        this.conditionMarkers = longestFirst(conditionMarkers);
        this.exceptionMarkers = longestFirst(exceptionMarkers);
        this.dependencyMarkers = longestFirst(dependencyMarkers);
        this.clauseSeparators = Set.copyOf(clauseSeparators);
        this.objectBoundaries = Set.copyOf(objectBoundaries);
        this.abbreviations = Set.copyOf(abbreviations);
        List<ScopeRule> rules = new ArrayList<>(scopeRules);
        rules.sort(Comparator.comparingInt((ScopeRule r) -> r.prefix().size()).reversed());
        this.scopeRules = List.copyOf(rules);
        this.scopeWindow = scopeWindow;
        this.activationCues = longestFirst(activationCues);
        this.terminationCues = longestFirst(terminationCues);
        this.lifecyclePhraseTokens = lifecyclePhraseTokens;
        this.instrumentWords = Set.copyOf(instrumentWords);
        this.designators = Map.copyOf(designators);
        this.romanDesignators = Set.copyOf(romanDesignators);
        this.jurisdictions = Map.copyOf(jurisdictions);
    }

    private static final class DefaultHolder {
        static final LegalLexicon DEFAULT = LexiconLoader.loadDefault();
    }

    /** The bundled {@code legal-lexicon-v1} tables, loaded once. */
    public static LegalLexicon defaults() {
        return DefaultHolder.DEFAULT;
    }

    // ── Matching ─────────────────────────────────────────────────────────────

    /** Longest pattern of {@code patterns} that starts at {@code index}, if any. */
    public static Optional<PhrasePattern> matchAt(List<PhrasePattern> patterns, List<String> normalized, int index) {
        for (PhrasePattern pattern : patterns) {
            if (pattern.matchesAt(normalized, index)) return Optional.of(pattern);
        }
        return Optional.empty();
    }

    public Optional<PhrasePattern> modalAt(List<String> normalized, int index) {
        return matchAt(modals, normalized, index);
    }

    /** Condition or exception marker at {@code index}; the tag is the condition type. */
    public Optional<PhrasePattern> markerAt(List<String> normalized, int index) {
        Optional<PhrasePattern> condition = matchAt(conditionMarkers, normalized, index);
        Optional<PhrasePattern> exception = matchAt(exceptionMarkers, normalized, index);
        if (condition.isPresent() && exception.isPresent()) {
            return condition.get().length() >= exception.get().length() ? condition : exception;
        }
        return condition.isPresent() ? condition : exception;
    }

    public boolean isExceptionTag(String tag) {
        return exceptionMarkers.stream().anyMatch(p -> p.tag().equals(tag));
    }

    public Optional<PhrasePattern> dependencyMarkerAt(List<String> normalized, int index) {
        return matchAt(dependencyMarkers, normalized, index);
    }

    // ── Accessors ────────────────────────────────────────────────────────────

    public String version() { return version; }
    public List<PhrasePattern> modals() { return modals; }
    public List<PhrasePattern> conditionMarkers() { return conditionMarkers; }
    public List<PhrasePattern> exceptionMarkers() { return exceptionMarkers; }
    public List<PhrasePattern> dependencyMarkers() { return dependencyMarkers; }
    public Set<String> clauseSeparators() { return clauseSeparators; }
    public Set<String> objectBoundaries() { return objectBoundaries; }
    public Set<String> abbreviations() { return abbreviations; }
    public List<ScopeRule> scopeRules() { return scopeRules; }
    public int scopeWindow() { return scopeWindow; }
    public List<PhrasePattern> activationCues() { return activationCues; }
    public List<PhrasePattern> terminationCues() { return terminationCues; }
    public int lifecyclePhraseTokens() { return lifecyclePhraseTokens; }
    public Set<String> instrumentWords() { return instrumentWords; }
    public Map<String, String> designators() { return designators; }
    public Set<String> romanDesignators() { return romanDesignators; }
    public Map<String, String> jurisdictions() { return jurisdictions; }

    private static List<PhrasePattern> longestFirst(List<PhrasePattern> patterns) {
        List<PhrasePattern> sorted = new ArrayList<>(patterns);
        sorted.sort(Comparator.comparingInt(PhrasePattern::length).reversed());
        return List.copyOf(sorted);
    }
}
