package org.sensiblaw.semantic.activation;

import org.sensiblaw.semantic.json.CanonicalJson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code obligation.activation.v1} payload. */
public final class ActivationPayloads {

    private ActivationPayloads() {}

    public static Map<String, Object> toPayload(ActivationResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", ActivationResult.VERSION);
        payload.put("active", result.active());
        payload.put("inactive", result.inactive());
        payload.put("terminated", result.terminated());
        Map<String, Object> reasons = new LinkedHashMap<>();
        result.reasons().forEach((id, list) -> {
            List<Map<String, Object>> entries = new ArrayList<>();
            for (ActivationReason reason : list) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("trigger", reason.trigger());
                r.put("text", reason.text());
                r.put("fact_key", reason.factKey());
                r.put("fact_value", reason.factValue());
                entries.add(r);
            }
            reasons.put(id, entries);
        });
        payload.put("reasons", reasons);
        return payload;
    }

    public static String toJson(ActivationResult result) {
        return CanonicalJson.write(toPayload(result));
    }
}
