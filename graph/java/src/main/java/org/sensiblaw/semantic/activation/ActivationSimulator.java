package org.sensiblaw.semantic.activation;

import org.sensiblaw.semantic.lexicon.TokenNormalizer;
import org.sensiblaw.semantic.obligation.LifecycleKind;
import org.sensiblaw.semantic.obligation.LifecycleTrigger;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptive activation: an obligation changes state only when a supplied fact key equals
 * one of its lifecycle triggers. Nothing is inferred.
 *
 * <p>A trigger matches a fact whose normalized key equals the trigger's normalized phrase
 * ({@code upon commencement}) or the phrase without its cue word ({@code commencement}).
 * A matching termination trigger wins over a matching activation trigger. Obligations
 * without lifecycle triggers stay inactive.
 */
public class ActivationSimulator {

    private static final Logger log = LoggerFactory.getLogger(ActivationSimulator.class);

    public ActivationResult simulate(List<ObligationIdentity> obligations, FactEnvelope envelope) {
        Map<String, Fact> facts = new LinkedHashMap<>();
        for (Fact fact : envelope.facts()) {
            String key = TokenNormalizer.normalize(fact.key());
            if (!key.isEmpty()) facts.put(key, fact);
        }

        List<String> active = new ArrayList<>();
        List<String> inactive = new ArrayList<>();
        List<String> terminated = new ArrayList<>();
        Map<String, List<ActivationReason>> reasons = new HashMap<>();

        for (ObligationIdentity obligation : obligations) {
            String id = obligation.identityHash();
            List<LifecycleTrigger> lifecycle = obligation.atom().lifecycle();
            Optional<ActivationReason> termination = firstMatch(lifecycle, LifecycleKind.TERMINATION, facts);
            Optional<ActivationReason> activation = termination.isPresent()
                    ? Optional.empty()
                    : firstMatch(lifecycle, LifecycleKind.ACTIVATION, facts);
            if (termination.isPresent()) {
                terminated.add(id);
                reasons.computeIfAbsent(id, k -> new ArrayList<>()).add(termination.get());
            } else if (activation.isPresent()) {
                active.add(id);
                reasons.computeIfAbsent(id, k -> new ArrayList<>()).add(activation.get());
            } else {
                inactive.add(id);
            }
        }
        log.info("Activation over {} obligations with {} facts: {} active, {} terminated, {} inactive",
                obligations.size(), facts.size(), active.size(), terminated.size(), inactive.size());
        return new ActivationResult(active, inactive, terminated, reasons);
    }

    private static Optional<ActivationReason> firstMatch(List<LifecycleTrigger> lifecycle, LifecycleKind kind,
                                                         Map<String, Fact> facts) {
        for (LifecycleTrigger trigger : lifecycle) {
            if (trigger.kind() != kind) continue;
            Fact fact = facts.get(trigger.normalized());
            if (fact == null) fact = facts.get(trigger.withoutCue());
            if (fact != null) {
                return Optional.of(new ActivationReason(kind.wireName(), trigger.text(), fact.key(), fact.value()));
            }
        }
        return Optional.empty();
    }
}
