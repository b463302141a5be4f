package org.sensiblaw.semantic.model;

/**
 * One token as delivered by the NLP collaborator.
 *
 * @param text      surface text
 * @param lemma     lemma, defaults to the lower-cased text
 * @param pos       coarse part-of-speech tag, empty when unknown
 * @param dep       dependency label, empty when unknown
 * @param startChar character offset of the first character in the body text
 * @param endChar   character offset one past the last character
 */
public record Token(
        String text,
        String lemma,
        String pos,
        String dep,
        int startChar,
        int endChar
) {
    public Token {
        text = text != null ? text : "";
        lemma = lemma != null && !lemma.isEmpty() ? lemma : text.toLowerCase();
        pos = pos != null ? pos : "";
        dep = dep != null ? dep : "";
    }

    public static Token of(String text, int startChar) {
        return new Token(text, null, null, null, startChar, startChar + text.length());
    }

    public boolean isVerb() {
        return "VERB".equalsIgnoreCase(pos);
    }
}
