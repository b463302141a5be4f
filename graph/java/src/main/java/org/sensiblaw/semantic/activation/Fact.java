package org.sensiblaw.semantic.activation;

/**
 * A declarative fact supplied from outside.
 *
 * @param key    matched exactly (after normalization) against lifecycle trigger text
 * @param value  opaque value, echoed into activation reasons
 * @param at     optional timestamp as supplied
 * @param source optional origin of the fact
 */
public record Fact(String key, Object value, String at, String source) {}
