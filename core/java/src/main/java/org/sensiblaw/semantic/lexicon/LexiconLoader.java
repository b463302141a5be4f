package org.sensiblaw.semantic.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads lexicon tables from YAML.
 */
public class LexiconLoader {

    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    public static final String DEFAULT_RESOURCE = "/lexicon/legal-lexicon-v1.yaml";

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static LegalLexicon loadDefault() {
        try (InputStream is = LexiconLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new LexiconException("Lexicon resource not found: " + DEFAULT_RESOURCE);
            }
            LegalLexicon lexicon = load(is);
            log.debug("Loaded lexicon {} from {}", lexicon.version(), DEFAULT_RESOURCE);
            return lexicon;
        } catch (IOException e) {
            throw new LexiconException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static LegalLexicon load(InputStream is) {
        Object data;
        try {
            data = YAML.load(is);
        } catch (YAMLException e) {
            throw new LexiconException("Malformed lexicon YAML: " + e.getMessage(), e);
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new LexiconException("Lexicon root must be a mapping");
        }
        return fromMap(asStringMap(map, "root"));
    }

    public static LegalLexicon fromMap(Map<String, Object> data) {
        String version = String.valueOf(data.getOrDefault("version", "unversioned"));

        Map<String, Object> scope = section(data, "scope");
        List<ScopeRule> scopeRules = new ArrayList<>();
        for (String category : List.of("time", "place", "context")) {
            Map<String, Object> cat = section(scope, category);
            for (List<String> phrase : phrases(cat.get("phrases"), "scope." + category + ".phrases")) {
                scopeRules.add(new ScopeRule(category, phrase, Set.of(), false));
            }
            for (List<String> prefix : phrases(cat.get("open"), "scope." + category + ".open")) {
                scopeRules.add(new ScopeRule(category, prefix, Set.of(), true));
            }
            for (Map<String, Object> bounded : mapList(cat.get("bounded"), "scope." + category + ".bounded")) {
                scopeRules.add(new ScopeRule(category,
                        words(bounded.get("prefix"), "bounded.prefix"),
                        new HashSet<>(words(bounded.get("units"), "bounded.units")),
                        false));
            }
        }

        Map<String, Object> lifecycle = section(data, "lifecycle");

        return new LegalLexicon(
                version,
                typed(data.get("modals"), "modals"),
                typed(data.get("condition_markers"), "condition_markers"),
                typed(data.get("exception_markers"), "exception_markers"),
                tagged(phrases(data.get("dependency_markers"), "dependency_markers"), "depends_on"),
                new HashSet<>(words(data.get("clause_separators"), "clause_separators")),
                new HashSet<>(words(data.get("object_boundaries"), "object_boundaries")),
                new HashSet<>(words(data.get("abbreviations"), "abbreviations")),
                scopeRules,
                intValue(scope.getOrDefault("max_window", 6), "scope.max_window"),
                tagged(phrases(lifecycle.get("activation"), "lifecycle.activation"), "activation"),
                tagged(phrases(lifecycle.get("termination"), "lifecycle.termination"), "termination"),
                intValue(lifecycle.getOrDefault("phrase_tokens", 3), "lifecycle.phrase_tokens"),
                new HashSet<>(words(data.get("instrument_words"), "instrument_words")),
                stringMap(data.get("designators"), "designators"),
                new HashSet<>(words(data.get("roman_designators"), "roman_designators")),
                stringMap(data.get("jurisdictions"), "jurisdictions"));
    }

    // ── YAML shape helpers ───────────────────────────────────────────────────

    private static List<PhrasePattern> typed(Object raw, String field) {
        List<PhrasePattern> patterns = new ArrayList<>();
        for (Map<String, Object> entry : mapList(raw, field)) {
            Object type = entry.get("type");
            if (type == null) {
                throw new LexiconException("Missing 'type' in " + field);
            }
            patterns.add(new PhrasePattern(words(entry.get("tokens"), field + ".tokens"), type.toString()));
        }
        return patterns;
    }

    private static List<PhrasePattern> tagged(List<List<String>> phrases, String tag) {
        return phrases.stream().map(p -> new PhrasePattern(p, tag)).toList();
    }

    private static List<List<String>> phrases(Object raw, String field) {
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> list)) {
            throw new LexiconException("'" + field + "' must be a list of token lists");
        }
        List<List<String>> out = new ArrayList<>();
        for (Object item : list) {
            out.add(words(item, field));
        }
        return out;
    }

    private static List<String> words(Object raw, String field) {
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> list)) {
            throw new LexiconException("'" + field + "' must be a list");
        }
        return list.stream().map(o -> TokenNormalizer.normalize(String.valueOf(o))).toList();
    }

    private static List<Map<String, Object>> mapList(Object raw, String field) {
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> list)) {
            throw new LexiconException("'" + field + "' must be a list of mappings");
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> m)) {
                throw new LexiconException("'" + field + "' entries must be mappings");
            }
            out.add(asStringMap(m, field));
        }
        return out;
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object raw = parent.get(key);
        if (raw == null) return Map.of();
        if (!(raw instanceof Map<?, ?> m)) {
            throw new LexiconException("'" + key + "' must be a mapping");
        }
        return asStringMap(m, key);
    }

    private static Map<String, String> stringMap(Object raw, String field) {
        if (raw == null) return Map.of();
        if (!(raw instanceof Map<?, ?> m)) {
            throw new LexiconException("'" + field + "' must be a mapping");
        }
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(k).toLowerCase(), String.valueOf(v).toLowerCase()));
        return out;
    }

    private static Map<String, Object> asStringMap(Map<?, ?> raw, String field) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static int intValue(Object raw, String field) {
        if (raw instanceof Number n) return n.intValue();
        throw new LexiconException("'" + field + "' must be an integer");
    }
}
