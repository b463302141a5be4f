package org.sensiblaw.semantic;

import org.sensiblaw.semantic.model.PageMap;
import org.sensiblaw.semantic.model.Sentence;
import org.sensiblaw.semantic.model.Token;
import org.sensiblaw.semantic.model.TokenStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Parses a token-stream document (YAML or JSON) into a {@link TokenStream}.
 *
 * <pre>
 * doc_id: nsw-spray-paint
 * rev_id: r1
 * sentences:
 *   - tokens:
 *       - {text: A, lemma: a, pos: DET, dep: det, start: 0, end: 1}
 * page_map:
 *   - {page: 1, start: 0, end: 12}
 * </pre>
 *
 * A document may carry {@code text} instead of {@code sentences}; it is then run
 * through the {@link FallbackTokenizer}.
 */
public class TokenStreamParser {

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static TokenStream parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static TokenStream parse(InputStream is) {
        Object data = YAML.load(is);
        if (!(data instanceof Map)) {
            throw new IllegalArgumentException("Token stream document must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        return fromMap(map);
    }

    @SuppressWarnings("unchecked")
    public static TokenStream fromMap(Map<String, Object> data) {
        String docId = stringOrNull(data.get("doc_id"));
        String revId = stringOrNull(data.get("rev_id"));

        if (!data.containsKey("sentences") && data.get("text") instanceof String text) {
            return new FallbackTokenizer().tokenize(docId, revId, text);
        }

        List<Map<String, Object>> sentenceMaps =
                (List<Map<String, Object>>) data.getOrDefault("sentences", List.of());
        List<Sentence> sentences = sentenceMaps.stream().map(TokenStreamParser::parseSentence).toList();

        List<Map<String, Object>> pageMaps =
                (List<Map<String, Object>>) data.getOrDefault("page_map", List.of());
        PageMap pageMap = new PageMap(pageMaps.stream().map(TokenStreamParser::parsePage).toList());

        return TokenStream.of(docId, revId, sentences, pageMap);
    }

    @SuppressWarnings("unchecked")
    private static Sentence parseSentence(Map<String, Object> s) {
        List<Map<String, Object>> tokenMaps = (List<Map<String, Object>>) s.getOrDefault("tokens", List.of());
        return new Sentence(tokenMaps.stream().map(TokenStreamParser::parseToken).toList());
    }

    private static Token parseToken(Map<String, Object> t) {
        Object text = t.get("text");
        if (text == null) {
            throw new IllegalArgumentException("Token without 'text': " + t);
        }
        int start = intOr(t.get("start"), 0);
        return new Token(
                text.toString(),
                stringOrNull(t.get("lemma")),
                stringOrNull(t.get("pos")),
                stringOrNull(t.get("dep")),
                start,
                intOr(t.get("end"), start + text.toString().length()));
    }

    private static PageMap.PageRange parsePage(Map<String, Object> p) {
        return new PageMap.PageRange(intOr(p.get("page"), 0), intOr(p.get("start"), 0), intOr(p.get("end"), 0));
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }

    private static int intOr(Object value, int fallback) {
        if (value == null) return fallback;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer, got '" + value + "'", e);
        }
    }
}
