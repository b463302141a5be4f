package org.sensiblaw.semantic.activation;

import java.util.Comparator;

/**
 * Why an obligation changed state.
 *
 * @param trigger    {@code activation} or {@code termination}
 * @param text       lifecycle trigger text as written
 * @param factKey    key of the matching fact
 * @param factValue  value of the matching fact
 */
public record ActivationReason(String trigger, String text, String factKey, Object factValue) {

    public static final Comparator<ActivationReason> ORDER = Comparator
            .comparing(ActivationReason::trigger)
            .thenComparing(ActivationReason::text)
            .thenComparing(ActivationReason::factKey);
}
