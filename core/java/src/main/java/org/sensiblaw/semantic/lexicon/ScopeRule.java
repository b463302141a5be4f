package org.sensiblaw.semantic.lexicon;

import java.util.List;
import java.util.Set;

/**
 * One scope-recognition rule.
 *
 * <ul>
 *   <li>fixed phrase: {@code units} empty and {@code open} false, matches {@code prefix} exactly</li>
 *   <li>bounded: {@code prefix} then at most the lexicon window of tokens ending on one of {@code units}</li>
 *   <li>open: {@code prefix} then tokens up to the next boundary or the window limit</li>
 * </ul>
 *
 * @param category wire name of the scope category ({@code time}, {@code place}, {@code context})
 */
public record ScopeRule(String category, List<String> prefix, Set<String> units, boolean open) {
    public ScopeRule {
        prefix = List.copyOf(prefix);
        units = Set.copyOf(units);
        if (prefix.isEmpty()) {
            throw new LexiconException("Empty scope prefix in category '" + category + "'");
        }
    }

    public boolean bounded() {
        return !units.isEmpty();
    }

    public boolean fixed() {
        return units.isEmpty() && !open;
    }

    public PhrasePattern prefixPattern() {
        return new PhrasePattern(prefix, category);
    }
}
