package org.sensiblaw.semantic.obligation;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigTest {

    @Test
    void defaultsBindEverything() {
        ExtractionConfig config = ExtractionConfig.defaults();
        assertTrue(config.enableActorBinding());
        assertTrue(config.enableActionBinding());
        assertEquals(config, ExtractionConfig.fromMap(Map.of()));
        assertEquals(config, ExtractionConfig.fromEnvironment(Map.of()));
    }

    @Test
    void readsYamlBooleans() {
        Map<String, Object> data = new Yaml(new SafeConstructor(new LoaderOptions()))
                .load("enable_actor_binding: true\nenable_action_binding: no\n");
        ExtractionConfig config = ExtractionConfig.fromMap(data);
        assertTrue(config.enableActorBinding());
        assertFalse(config.enableActionBinding());
    }

    @Test
    void readsStringSwitches() {
        ExtractionConfig config = ExtractionConfig.fromMap(Map.of(
                "enable_actor_binding", "OFF",
                "enable_action_binding", "yes"));
        assertFalse(config.enableActorBinding());
        assertTrue(config.enableActionBinding());
    }

    @Test
    void readsEnvironmentSwitches() {
        ExtractionConfig config = ExtractionConfig.fromEnvironment(Map.of(
                ExtractionConfig.ACTOR_BINDING_ENV, "0",
                ExtractionConfig.ACTION_BINDING_ENV, " false "));
        assertFalse(config.enableActorBinding());
        assertFalse(config.enableActionBinding());

        assertTrue(ExtractionConfig.fromEnvironment(Map.of(ExtractionConfig.ACTOR_BINDING_ENV, "1")).enableActorBinding());
    }
}
