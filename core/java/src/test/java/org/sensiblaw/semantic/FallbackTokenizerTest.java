package org.sensiblaw.semantic;

import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackTokenizerTest {

    private final FallbackTokenizer tokenizer = new FallbackTokenizer();

    private static List<String> texts(TokenStream stream) {
        return stream.tokens().stream().map(Token::text).toList();
    }

    @Test
    void detachesTrailingPunctuation() {
        TokenStream stream = tokenizer.tokenize("d", "r", "A person must not sell spray paint unless licensed.");
        assertEquals(List.of("A", "person", "must", "not", "sell", "spray", "paint", "unless", "licensed", "."),
                texts(stream));
        assertEquals(List.of(10), stream.sentenceEnds());
    }

    @Test
    void keepsBalancedBracketsAttached() {
        TokenStream stream = tokenizer.tokenize("d", "r", "(a) see s5(2) of the Crimes Act 1900 (NSW).");
        List<String> texts = texts(stream);
        assertEquals("(a)", texts.get(0));
        assertTrue(texts.contains("s5(2)"));
        assertTrue(texts.contains("(NSW)"));
        assertEquals(".", texts.get(texts.size() - 1));
    }

    @Test
    void recordsCharacterOffsets() {
        TokenStream stream = tokenizer.tokenize("d", "r", "The Minister may waive the fee.");
        Token minister = stream.get(1);
        assertEquals("Minister", minister.text());
        assertEquals(4, minister.startChar());
        assertEquals(12, minister.endChar());
        assertEquals("minister", minister.lemma());
        assertEquals("", minister.pos());
    }

    @Test
    void splitsSentencesButNotAfterAbbreviations() {
        TokenStream stream = tokenizer.tokenize("d", "r",
                "An inspector may enter under s. 5 of the Act. The Minister may waive the fee.");
        assertEquals(2, stream.sentenceSpans().size());
    }

    @Test
    void numberedParagraphDoesNotEndAtItsNumber() {
        TokenStream stream = tokenizer.tokenize("d", "r", "1. A retailer must keep records. 2. A person may sell paint.");
        assertEquals(2, stream.sentenceSpans().size());
        assertEquals("1", stream.get(0).text());
    }

    @Test
    void formFeedStartsNewPage() {
        TokenStream stream = tokenizer.tokenize("d", "r", "A retailer must keep records.\fThe Minister may waive the fee.");
        assertEquals(2, stream.pageMap().ranges().size());
        assertEquals(List.of(1), stream.pageMap().pagesFor(stream.span(0, 2)));
        assertEquals(List.of(2), stream.pageMap().pagesFor(stream.span(6, 8)));
    }

    @Test
    void emptyTextYieldsEmptyStream() {
        TokenStream stream = tokenizer.tokenize("d", "r", "");
        assertTrue(stream.isEmpty());
        assertTrue(stream.sentenceEnds().isEmpty());
    }
}
