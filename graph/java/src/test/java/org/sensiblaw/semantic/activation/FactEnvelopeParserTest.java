package org.sensiblaw.semantic.activation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FactEnvelopeParserTest {

    private static FactEnvelope parse(String text) {
        return FactEnvelopeParser.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void parsesYamlFixture() throws Exception {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("fixtures/commencement-facts.yaml")) {
            assertNotNull(is, "fixture missing");
            FactEnvelope envelope = FactEnvelopeParser.parse(is);
            assertEquals(FactEnvelope.VERSION, envelope.version());
            assertEquals("2024-07-01T00:00:00Z", envelope.issuedAt());
            assertEquals(2, envelope.facts().size());

            Fact first = envelope.facts().get(0);
            assertEquals("commencement", first.key());
            assertEquals(Boolean.TRUE, first.value());
            assertEquals("2024-07-01", first.at());
            assertEquals("gazette", first.source());
            assertNull(envelope.facts().get(1).source());
        }
    }

    @Test
    void parsesJsonFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("facts.json");
        Files.writeString(file, """
                {"version": "fact.envelope.v1", "facts": [{"key": "upon approval", "value": "2024-02-01"}]}
                """);
        FactEnvelope envelope = FactEnvelopeParser.parse(file);
        assertEquals(1, envelope.facts().size());
        assertEquals("upon approval", envelope.facts().get(0).key());
        assertEquals("2024-02-01", envelope.facts().get(0).value());
        assertNull(envelope.issuedAt());
    }

    @Test
    void missingVersionAndFactsAreAllowed() {
        FactEnvelope envelope = parse("issued_at: today\n");
        assertEquals(FactEnvelope.VERSION, envelope.version());
        assertTrue(envelope.facts().isEmpty());
    }

    @Test
    void rejectsWrongVersion() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parse("version: fact.envelope.v9\nfacts: []\n"));
        assertTrue(e.getMessage().contains("fact.envelope.v9"));
    }

    @Test
    void rejectsMalformedFacts() {
        assertThrows(IllegalArgumentException.class, () -> parse("facts: commencement\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("facts:\n  - commencement\n"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parse("facts:\n  - key: commencement\n  - value: true\n"));
        assertTrue(e.getMessage().contains("facts[1]"));
    }

    @Test
    void rejectsNonMappingAndInvalidYaml() {
        assertThrows(IllegalArgumentException.class, () -> parse("- a\n- b\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("facts: [unclosed\n"));
    }
}
