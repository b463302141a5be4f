package org.sensiblaw.semantic.obligation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Post-extraction refinement chain. Each step builds new atoms and never touches its
 * input; each output traces back to one or more inputs, so counts can only shrink.
 *
 * <ol>
 *   <li>{@link #normalize}: atoms of one clause with identical identity payloads merge;
 *       their scopes and lifecycle triggers are unioned in source order</li>
 *   <li>{@link #consolidate}: one scope per category (shortest, then leftmost) and one
 *       lifecycle trigger per kind (leftmost)</li>
 * </ol>
 */
public final class ObligationRefiner {

    private ObligationRefiner() {}

    /**
     * @param atoms   output atoms
     * @param lineage for each output atom, the indexes of the input atoms it came from
     */
    public record RefinementResult(List<ObligationAtom> atoms, List<List<Integer>> lineage) {
        public RefinementResult {
            atoms = List.copyOf(atoms);
            lineage = lineage.stream().map(List::copyOf).toList();
        }
    }

    public record Refinement(List<ObligationAtom> raw, RefinementResult normalized, RefinementResult consolidated) {
        public Refinement {
            raw = List.copyOf(raw);
        }

        public List<ObligationAtom> atoms() {
            return consolidated.atoms();
        }
    }

    public static Refinement refine(List<ObligationAtom> raw) {
        RefinementResult normalized = normalize(raw);
        return new Refinement(raw, normalized, consolidate(normalized.atoms()));
    }

    public static RefinementResult normalize(List<ObligationAtom> atoms) {
        Map<String, Integer> slotByKey = new LinkedHashMap<>();
        List<ObligationAtom> out = new ArrayList<>();
        List<List<Integer>> lineage = new ArrayList<>();
        for (int i = 0; i < atoms.size(); i++) {
            ObligationAtom atom = atoms.get(i);
            String key = atom.clauseId() + "|" + ObligationPayloads.identityPayload(atom);
            Integer slot = slotByKey.get(key);
            if (slot == null) {
                slotByKey.put(key, out.size());
                out.add(atom);
                lineage.add(new ArrayList<>(List.of(i)));
            } else {
                ObligationAtom kept = out.get(slot);
                Set<ScopeAtom> scopes = new LinkedHashSet<>(kept.scopes());
                scopes.addAll(atom.scopes());
                Set<LifecycleTrigger> lifecycle = new LinkedHashSet<>(kept.lifecycle());
                lifecycle.addAll(atom.lifecycle());
                out.set(slot, kept.withScopes(new ArrayList<>(scopes), new ArrayList<>(lifecycle)));
                lineage.get(slot).add(i);
            }
        }
        return new RefinementResult(out, lineage);
    }

    public static RefinementResult consolidate(List<ObligationAtom> atoms) {
        List<ObligationAtom> out = new ArrayList<>(atoms.size());
        List<List<Integer>> lineage = new ArrayList<>(atoms.size());
        for (int i = 0; i < atoms.size(); i++) {
            ObligationAtom atom = atoms.get(i);
            Map<ScopeCategory, ScopeAtom> best = new EnumMap<>(ScopeCategory.class);
            Comparator<ScopeAtom> preference = Comparator
                    .comparingInt((ScopeAtom s) -> s.span().length())
                    .thenComparingInt(s -> s.span().start());
            for (ScopeAtom scope : atom.scopes()) {
                best.merge(scope.category(), scope, (a, b) -> preference.compare(a, b) <= 0 ? a : b);
            }
            Map<LifecycleKind, LifecycleTrigger> firstTrigger = new EnumMap<>(LifecycleKind.class);
            atom.lifecycle().stream()
                    .sorted(Comparator.comparingInt(t -> t.span().start()))
                    .forEach(t -> firstTrigger.putIfAbsent(t.kind(), t));
            List<ScopeAtom> scopes = best.values().stream()
                    .sorted(Comparator.comparingInt(s -> s.span().start())).toList();
            List<LifecycleTrigger> lifecycle = firstTrigger.values().stream()
                    .sorted(Comparator.comparingInt(t -> t.span().start())).toList();
            out.add(atom.withScopes(scopes, lifecycle));
            lineage.add(List.of(i));
        }
        return new RefinementResult(out, lineage);
    }
}
