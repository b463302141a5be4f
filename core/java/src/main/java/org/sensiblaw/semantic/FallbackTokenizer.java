package org.sensiblaw.semantic;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.model.PageMap;
import org.sensiblaw.semantic.model.Sentence;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deterministic whitespace-and-punctuation tokenizer used when no NLP collaborator is
 * attached. Produces lemma = lower-cased text and empty POS/dependency labels.
 *
 * <p>Leading opening brackets and quotes and trailing punctuation become their own
 * tokens. A closing bracket stays attached when it balances an opening bracket inside
 * the same chunk, so {@code s5(2)} and {@code (a)} survive as single tokens.
 *
 * <p>A form feed ({@code \f}) in the body text starts a new page; the resulting
 * {@link PageMap} is attached to the stream.
 */
public final class FallbackTokenizer {

    private static final String LEADING = "([{\"'“‘";
    private static final String TRAILING = ".,;:!?)]}\"'”’";
    private static final Set<String> TERMINATORS = Set.of(".", "?", "!");

    private final Set<String> abbreviations;

    public FallbackTokenizer() {
        this(LegalLexicon.defaults());
    }

    public FallbackTokenizer(LegalLexicon lexicon) {
        this.abbreviations = lexicon.abbreviations();
    }

    public TokenStream tokenize(String docId, String revId, String text) {
        List<Token> tokens = new ArrayList<>();
        List<Integer> tokenPages = new ArrayList<>();
        int page = 1;
        int i = 0;
        int n = text == null ? 0 : text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\f') {
                page++;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(text.charAt(i))) i++;
            for (Token token : split(text.substring(start, i), start)) {
                tokens.add(token);
                tokenPages.add(page);
            }
        }
        return new TokenStream(docId, revId, tokens, sentenceEnds(tokens), pageMap(tokenPages));
    }

    /** Splits one whitespace-free chunk into leading punctuation, a core, and trailing punctuation. */
    private List<Token> split(String chunk, int offset) {
        List<Token> out = new ArrayList<>();
        int from = 0;
        int to = chunk.length();
        while (from < to && LEADING.indexOf(chunk.charAt(from)) >= 0 && !balancedBracketAt(chunk, from, to)) {
            out.add(Token.of(String.valueOf(chunk.charAt(from)), offset + from));
            from++;
        }
        List<Token> trailing = new ArrayList<>();
        while (to > from && TRAILING.indexOf(chunk.charAt(to - 1)) >= 0) {
            char last = chunk.charAt(to - 1);
            if (isClosing(last) && balanced(chunk.substring(from, to))) break;
            if (last == '.' && keepsFullStop(chunk.substring(from, to))) break;
            trailing.add(0, Token.of(String.valueOf(last), offset + to - 1));
            to--;
        }
        if (to > from) {
            out.add(Token.of(chunk.substring(from, to), offset + from));
        }
        out.addAll(trailing);
        return out;
    }

    /** Keeps the full stop of inner-dotted abbreviations such as {@code e.g.} attached. */
    private static boolean keepsFullStop(String core) {
        return core.length() > 2 && core.substring(0, core.length() - 1).contains(".")
                && Character.isLetter(core.charAt(core.length() - 2));
    }

    private static boolean balancedBracketAt(String chunk, int from, int to) {
        char open = chunk.charAt(from);
        if (open != '(' && open != '[' && open != '{') return false;
        String rest = chunk.substring(from, to);
        while (!rest.isEmpty() && TRAILING.indexOf(rest.charAt(rest.length() - 1)) >= 0
                && !isClosing(rest.charAt(rest.length() - 1))) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest.length() > 2 && balanced(rest) && isClosing(rest.charAt(rest.length() - 1))
                && rest.indexOf(closerOf(open)) == rest.length() - 1;
    }

    private static boolean isClosing(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    private static boolean balanced(String s) {
        int depth = 0;
        for (char c : s.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') depth++;
            if (isClosing(c)) {
                if (depth == 0) return false;
                depth--;
            }
        }
        return depth == 0;
    }

    private List<Integer> sentenceEnds(List<Token> tokens) {
        List<Integer> ends = new ArrayList<>();
        int sentenceStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (!TERMINATORS.contains(tokens.get(i).text())) continue;
            if (i + 1 < tokens.size() && !closesSentence(tokens, sentenceStart, i)) continue;
            ends.add(i + 1);
            sentenceStart = i + 1;
        }
        if (sentenceStart < tokens.size()) ends.add(tokens.size());
        return ends;
    }

    private boolean closesSentence(List<Token> tokens, int sentenceStart, int terminator) {
        if (terminator == sentenceStart) return false;
        String previous = tokens.get(terminator - 1).text();
        String prevLower = previous.toLowerCase();
        if (abbreviations.contains(prevLower)) return false;
        // "1." or "(a)." opening a numbered paragraph
        if (terminator - 1 == sentenceStart && prevLower.matches("\\(?[0-9]+[a-z]?\\)?|\\(?[a-z]\\)?|\\(?[ivxlcdm]+\\)?")) {
            return false;
        }
        String next = tokens.get(terminator + 1).text();
        return next.isEmpty() || !Character.isLowerCase(next.codePointAt(0));
    }

    private static PageMap pageMap(List<Integer> tokenPages) {
        List<PageMap.PageRange> ranges = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= tokenPages.size(); i++) {
            if (i == tokenPages.size() || !tokenPages.get(i).equals(tokenPages.get(start))) {
                ranges.add(new PageMap.PageRange(tokenPages.get(start), start, i));
                start = i;
            }
        }
        return new PageMap(ranges);
    }

    /** Convenience for single-sentence fixtures. */
    public static Sentence sentence(String text) {
        return new Sentence(new FallbackTokenizer().tokenize("document", "r0", text).tokens());
    }
}
