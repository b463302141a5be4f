package org.sensiblaw.semantic.lexicon;

import org.sensiblaw.semantic.model.Token;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonical token normalization shared by every stage. Matching always happens on
 * these forms so that spacing, ligatures and stray punctuation cannot change a result.
 */
public final class TokenNormalizer {

    private TokenNormalizer() {}

    private static final String EDGE_PUNCTUATION = ".,;:!?\"'()[]{}“”‘’«»";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBERING = Pattern.compile("\\d+[a-z]?|[ivxlcdm]+|[a-z]");

    public static String normalize(String text) {
        if (text == null) return "";
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase();
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        int from = 0;
        int to = s.length();
        while (from < to && EDGE_PUNCTUATION.indexOf(s.charAt(from)) >= 0) from++;
        while (to > from && EDGE_PUNCTUATION.indexOf(s.charAt(to - 1)) >= 0) to--;
        return s.substring(from, to);
    }

    public static String normalize(Token token) {
        return normalize(token.text());
    }

    public static List<String> normalizeAll(List<Token> tokens) {
        return tokens.stream().map(TokenNormalizer::normalize).toList();
    }

    /** Normalizes each token and joins the non-empty forms with single spaces. */
    public static String phrase(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            String n = normalize(token);
            if (n.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(n);
        }
        return sb.toString();
    }

    /** Surface text of {@code tokens} joined with single spaces. */
    public static String surface(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(token.text());
        }
        return sb.toString();
    }

    public static boolean isPunctuation(Token token) {
        return !token.text().isEmpty() && normalize(token).isEmpty();
    }

    public static boolean isPunctuation(Token token, char c) {
        return token.text().strip().equals(String.valueOf(c));
    }

    /**
     * True if the token at {@code index} is list numbering such as {@code 1.}, {@code (a)}
     * or {@code (iv)}. A bare letter only counts when bracketed or when it opens the
     * sequence followed by a full stop, so the article in "A person must ..." is never numbering.
     */
    public static boolean isNumbering(List<Token> tokens, int index) {
        String raw = tokens.get(index).text().strip().toLowerCase();
        if (BRACKETED.matcher(raw).matches() || DIGITS.matcher(raw).matches()) return true;
        if (LETTER_DOT.matcher(raw).matches()) return index == 0;
        String n = normalize(raw);
        if (!NUMBERING.matcher(n).matches()) return false;
        boolean openBefore = index > 0 && isPunctuation(tokens.get(index - 1), '(');
        boolean closeAfter = index + 1 < tokens.size()
                && (isPunctuation(tokens.get(index + 1), ')') || isPunctuation(tokens.get(index + 1), '.'));
        return openBefore && closeAfter || index == 0 && closeAfter;
    }

    private static final Pattern BRACKETED = Pattern.compile("\\(?(\\d+[a-z]?|[a-z]|[ivxlcdm]+)\\)");
    private static final Pattern DIGITS = Pattern.compile("\\d+[a-z]?\\.?");
    private static final Pattern LETTER_DOT = Pattern.compile("([a-z]|[ivxlcdm]+)\\.");
}
