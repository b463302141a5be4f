package org.sensiblaw.semantic.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The canonical, normalized token stream of one document revision.
 *
 * <p>Tokens are flattened across sentences; {@code sentenceEnds} holds the exclusive end
 * index of every sentence in ascending order.
 */
public record TokenStream(
        String docId,
        String revId,
        List<Token> tokens,
        List<Integer> sentenceEnds,
        PageMap pageMap
) {
    public TokenStream {
        docId = docId != null ? docId : "document";
        revId = revId != null ? revId : "r0";
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        sentenceEnds = sentenceEnds != null ? List.copyOf(sentenceEnds) : List.of();
        pageMap = pageMap != null ? pageMap : PageMap.empty();
        int previous = 0;
        for (int end : sentenceEnds) {
            if (end < previous || end > tokens.size()) {
                throw new IllegalArgumentException("Sentence boundary " + end + " out of order or out of range");
            }
            previous = end;
        }
    }

    public static TokenStream of(String docId, String revId, List<Sentence> sentences) {
        return of(docId, revId, sentences, PageMap.empty());
    }

    public static TokenStream of(String docId, String revId, List<Sentence> sentences, PageMap pageMap) {
        List<Token> flat = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        for (Sentence sentence : sentences) {
            if (sentence.tokens().isEmpty()) continue;
            flat.addAll(sentence.tokens());
            ends.add(flat.size());
        }
        return new TokenStream(docId, revId, flat, ends, pageMap);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public TextSpan span(int start, int end) {
        TextSpan span = TextSpan.tokens(docId, revId, start, end);
        checkSpan(span);
        return span;
    }

    /**
     * Fails loudly when {@code span} does not index into this stream.
     *
     * @throws SpanOutOfBoundsException if the span is foreign or out of range
     */
    public void checkSpan(TextSpan span) {
        if (span.source() != SpanSource.TOKEN
                || !docId.equals(span.docId())
                || !revId.equals(span.revId())
                || span.end() > tokens.size()) {
            throw new SpanOutOfBoundsException(span, tokens.size());
        }
    }

    public List<Token> slice(TextSpan span) {
        checkSpan(span);
        return tokens.subList(span.start(), span.end());
    }

    /** Token texts of {@code span} joined with single spaces. */
    public String text(TextSpan span) {
        return slice(span).stream().map(Token::text).collect(Collectors.joining(" "));
    }

    /** Token ranges of the sentences, as {@code [start, end)} spans. */
    public List<TextSpan> sentenceSpans() {
        List<TextSpan> spans = new ArrayList<>();
        int start = 0;
        for (int end : sentenceEnds) {
            if (end > start) spans.add(TextSpan.tokens(docId, revId, start, end));
            start = end;
        }
        if (start < tokens.size()) {
            spans.add(TextSpan.tokens(docId, revId, start, tokens.size()));
        }
        return spans;
    }
}
