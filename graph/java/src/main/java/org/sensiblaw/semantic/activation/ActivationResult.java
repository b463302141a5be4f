package org.sensiblaw.semantic.activation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one activation run. Every obligation lands in exactly one of
 * {@code active}, {@code inactive} and {@code terminated}; each list is sorted.
 */
public record ActivationResult(
        List<String> active,
        List<String> inactive,
        List<String> terminated,
        Map<String, List<ActivationReason>> reasons
) {
    public static final String VERSION = "obligation.activation.v1";

    public ActivationResult {
        active = active.stream().sorted().toList();
        inactive = inactive.stream().sorted().toList();
        terminated = terminated.stream().sorted().toList();
        Map<String, List<ActivationReason>> sorted = new TreeMap<>();
        reasons.forEach((id, list) -> sorted.put(id, list.stream().sorted(ActivationReason.ORDER).toList()));
        reasons = Collections.unmodifiableMap(sorted);
    }
}
