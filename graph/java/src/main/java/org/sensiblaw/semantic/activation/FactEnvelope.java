package org.sensiblaw.semantic.activation;

import java.util.List;

/** {@code fact.envelope.v1}: the facts one activation run sees. */
public record FactEnvelope(String version, String issuedAt, List<Fact> facts) {

    public static final String VERSION = "fact.envelope.v1";

    public FactEnvelope {
        version = version != null ? version : VERSION;
        facts = facts != null ? List.copyOf(facts) : List.of();
    }

    public static FactEnvelope of(List<Fact> facts) {
        return new FactEnvelope(VERSION, null, facts);
    }
}
