package org.sensiblaw.semantic.lexicon;

import java.util.List;

/**
 * A normalized token sequence with the tag it stands for, e.g. {@code [must, not] -> prohibition}.
 */
public record PhrasePattern(List<String> tokens, String tag) {
    public PhrasePattern {
        tokens = List.copyOf(tokens);
        if (tokens.isEmpty()) {
            throw new LexiconException("Empty phrase for tag '" + tag + "'");
        }
    }

    public int length() {
        return tokens.size();
    }

    /** Space-joined surface form, e.g. {@code "must not"}. */
    public String surface() {
        return String.join(" ", tokens);
    }

    /** True if {@code normalized} holds this phrase starting at {@code index}. */
    public boolean matchesAt(List<String> normalized, int index) {
        return endAt(normalized, index) >= 0;
    }

    /**
     * End (exclusive) of this phrase starting at {@code index}, or -1. Tokens that normalize
     * to nothing are skipped between words, so {@code must ( not} still reads as
     * {@code must not}; the returned end counts them.
     */
    public int endAt(List<String> normalized, int index) {
        if (index < 0 || index >= normalized.size() || !tokens.get(0).equals(normalized.get(index))) return -1;
        int j = index + 1;
        for (int i = 1; i < tokens.size(); i++) {
            while (j < normalized.size() && normalized.get(j).isEmpty()) j++;
            if (j >= normalized.size() || !tokens.get(i).equals(normalized.get(j))) return -1;
            j++;
        }
        return j;
    }
}
