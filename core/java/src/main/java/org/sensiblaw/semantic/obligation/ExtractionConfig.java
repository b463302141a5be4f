package org.sensiblaw.semantic.obligation;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Binding switches for obligation extraction. When a binding is off, the bound fields
 * stay {@code null} and drop out of the obligation identity.
 *
 * @param enableActorBinding  bind the actor phrase
 * @param enableActionBinding bind the action and object phrases
 */
public record ExtractionConfig(boolean enableActorBinding, boolean enableActionBinding) {

    public static final String ACTOR_BINDING_ENV = "OBLIGATIONS_ENABLE_ACTOR_BINDING";
    public static final String ACTION_BINDING_ENV = "OBLIGATIONS_ENABLE_ACTION_BINDING";

    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "off", "");

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(true, true);
    }

    /**
     * Reads {@code enable_actor_binding} / {@code enable_action_binding} from a parsed
     * YAML or JSON mapping; missing keys keep the defaults.
     */
    public static ExtractionConfig fromMap(Map<String, Object> data) {
        return new ExtractionConfig(
                flag(data.get("enable_actor_binding"), true),
                flag(data.get("enable_action_binding"), true));
    }

    /**
     * Reads the {@value #ACTOR_BINDING_ENV} and {@value #ACTION_BINDING_ENV} switches from an
     * explicitly supplied environment map, e.g. {@code System.getenv()} at the application edge.
     */
    public static ExtractionConfig fromEnvironment(Map<String, String> env) {
        return new ExtractionConfig(
                flag(env.get(ACTOR_BINDING_ENV), true),
                flag(env.get(ACTION_BINDING_ENV), true));
    }

    private static boolean flag(Object value, boolean fallback) {
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        return !FALSE_VALUES.contains(value.toString().strip().toLowerCase(Locale.ROOT));
    }
}
