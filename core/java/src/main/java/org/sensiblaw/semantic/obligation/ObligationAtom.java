package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * One normative statement read from a single clause. Atoms are never mutated; a
 * refinement step builds a new atom that supersedes the old one.
 *
 * @param type                obligation, permission, prohibition or exclusion
 * @param modality            canonical modal trigger, e.g. {@code must not}
 * @param clauseId            id of the CLAUSE node the atom came from
 * @param actor               bound actor, or {@code null}
 * @param action              bound action, or {@code null}
 * @param object              bound object, or {@code null}
 * @param conditions          conditions and exceptions in source order
 * @param scopes              scope attachments in source order
 * @param lifecycle           lifecycle triggers in source order
 * @param referenceIdentities CR-ID hashes of references inside the clause, sorted and distinct
 * @param span                span of the clause
 * @param provenance          display-only provenance
 */
public record ObligationAtom(
        ObligationType type,
        String modality,
        String clauseId,
        PhraseAtom actor,
        PhraseAtom action,
        PhraseAtom object,
        List<ConditionAtom> conditions,
        List<ScopeAtom> scopes,
        List<LifecycleTrigger> lifecycle,
        List<String> referenceIdentities,
        TextSpan span,
        ObligationProvenance provenance
) {
    public ObligationAtom {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        lifecycle = lifecycle != null ? List.copyOf(lifecycle) : List.of();
        referenceIdentities = referenceIdentities != null ? List.copyOf(new TreeSet<>(referenceIdentities)) : List.of();
    }

    public Optional<ScopeAtom> scope(ScopeCategory category) {
        return scopes.stream().filter(s -> s.category() == category).findFirst();
    }

    public Optional<LifecycleTrigger> activationTrigger() {
        return lifecycle.stream().filter(t -> t.kind() == LifecycleKind.ACTIVATION).findFirst();
    }

    public Optional<LifecycleTrigger> terminationTrigger() {
        return lifecycle.stream().filter(t -> t.kind() == LifecycleKind.TERMINATION).findFirst();
    }

    public ObligationAtom withScopes(List<ScopeAtom> newScopes, List<LifecycleTrigger> newLifecycle) {
        return new ObligationAtom(type, modality, clauseId, actor, action, object, conditions,
                newScopes, newLifecycle, referenceIdentities, span, provenance);
    }
}
