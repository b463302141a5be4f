package org.sensiblaw.semantic.obligation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only projections of an obligation list: by actor, by action, by clause, and a
 * lifecycle timeline. All outputs are ordered deterministically; obligations inside a
 * group follow document order.
 */
public final class ObligationViews {

    public static final String UNBOUND = "unknown";

    private static final Comparator<ObligationIdentity> DOCUMENT_ORDER = Comparator
            .comparing((ObligationIdentity o) -> o.atom().provenance() != null ? o.atom().provenance().sourceId() : "")
            .thenComparingInt(o -> o.atom().provenance() != null ? o.atom().provenance().clauseIndex() : 0)
            .thenComparingInt(o -> o.atom().span() != null ? o.atom().span().start() : 0)
            .thenComparing(ObligationIdentity::identityHash);

    private ObligationViews() {}

    public static List<Map<String, Object>> actorView(List<ObligationIdentity> obligations) {
        return grouped("actor", obligations, o -> o.atom().actor());
    }

    public static List<Map<String, Object>> actionView(List<ObligationIdentity> obligations) {
        return grouped("action", obligations, o -> o.atom().action());
    }

    public static List<Map<String, Object>> clauseView(List<ObligationIdentity> obligations) {
        return sorted(obligations).stream().map(ObligationPayloads::withIdentity).toList();
    }

    public static List<Map<String, Object>> timelineView(List<ObligationIdentity> obligations) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ObligationIdentity o : sorted(obligations)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("obl_id", o.identityHash());
            entry.put("clause_id", o.clauseId());
            entry.put("modality", o.atom().modality());
            entry.put("action", ObligationPayloads.normalized(o.atom().action()));
            List<Map<String, Object>> lifecycle = new ArrayList<>();
            o.atom().lifecycle().stream()
                    .sorted(Comparator.comparing((LifecycleTrigger l) -> l.kind().wireName())
                            .thenComparing(LifecycleTrigger::normalized))
                    .forEach(l -> {
                        Map<String, Object> m = new LinkedHashMap<>();
                        m.put("kind", l.kind().wireName());
                        m.put("normalized", l.normalized());
                        m.put("text", l.text());
                        lifecycle.add(m);
                    });
            entry.put("lifecycle", lifecycle);
            out.add(entry);
        }
        return out;
    }

    private static List<Map<String, Object>> grouped(String key, List<ObligationIdentity> obligations, Function<ObligationIdentity, PhraseAtom> field) {
        Map<String, List<ObligationIdentity>> buckets = new TreeMap<>();
        for (ObligationIdentity o : sorted(obligations)) {
            PhraseAtom phrase = field.apply(o);
            String name = phrase != null ? phrase.normalized() : UNBOUND;
            buckets.computeIfAbsent(name, k -> new ArrayList<>()).add(o);
        }
        List<Map<String, Object>> out = new ArrayList<>();
        buckets.forEach((name, group) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(key, name);
            entry.put("obligations", group.stream().map(ObligationPayloads::withIdentity).toList());
            out.add(entry);
        });
        return out;
    }

    private static List<ObligationIdentity> sorted(List<ObligationIdentity> obligations) {
        return obligations.stream().sorted(DOCUMENT_ORDER).toList();
    }
}
