package org.sensiblaw.semantic.activation;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code fact.envelope.v1} documents (YAML or JSON):
 *
 * <pre>
 * version: fact.envelope.v1
 * issued_at: "2024-01-01T00:00:00Z"
 * facts:
 *   - key: commencement
 *     value: true
 *     source: gazette
 * </pre>
 */
public class FactEnvelopeParser {

    public static FactEnvelope parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static FactEnvelope parse(InputStream is) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        try {
            loaded = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Fact envelope is not valid YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Fact envelope must be a YAML/JSON mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) loaded;
        return fromMap(data);
    }

    @SuppressWarnings("unchecked")
    public static FactEnvelope fromMap(Map<String, Object> data) {
        String version = str(data.get("version"));
        if (version != null && !FactEnvelope.VERSION.equals(version)) {
            throw new IllegalArgumentException("Unsupported fact envelope version '" + version + "'");
        }
        Object rawFacts = data.get("facts");
        List<Fact> facts = new ArrayList<>();
        if (rawFacts != null) {
            if (!(rawFacts instanceof List)) {
                throw new IllegalArgumentException("'facts' must be a list");
            }
            int index = 0;
            for (Object item : (List<Object>) rawFacts) {
                if (!(item instanceof Map)) {
                    throw new IllegalArgumentException("facts[" + index + "] must be a mapping");
                }
                facts.add(parseFact((Map<String, Object>) item, index));
                index++;
            }
        }
        return new FactEnvelope(FactEnvelope.VERSION, str(data.get("issued_at")), facts);
    }

    private static Fact parseFact(Map<String, Object> data, int index) {
        String key = str(data.get("key"));
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("facts[" + index + "] is missing 'key'");
        }
        return new Fact(key, data.get("value"), str(data.get("at")), str(data.get("source")));
    }

    private static String str(Object value) {
        return value != null ? value.toString() : null;
    }
}
