package org.sensiblaw.semantic.obligation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aligns two revisions by OBL-ID and reports metadata changes on obligations whose
 * identity survived. Scope and lifecycle changes surface as {@code modified}; pure
 * formatting does not, since it never reaches the normalized fields.
 */
public final class ObligationAlignment {

    public static final String VERSION = "obligation.alignment.v1";

    private ObligationAlignment() {}

    public record FieldChange(String field, Object oldValue, Object newValue) {}

    public record AlignmentDelta(String identityHash, ObligationAtom before, ObligationAtom after,
                                 List<FieldChange> changes) {
        public AlignmentDelta {
            changes = List.copyOf(changes);
        }
    }

    /** All lists sorted by identity hash; {@code unchanged} excludes modified entries. */
    public record AlignmentReport(List<ObligationIdentity> added, List<ObligationIdentity> removed,
                                  List<ObligationIdentity> unchanged, List<AlignmentDelta> modified) {
        public AlignmentReport {
            added = List.copyOf(added);
            removed = List.copyOf(removed);
            unchanged = List.copyOf(unchanged);
            modified = List.copyOf(modified);
        }
    }

    public static AlignmentReport align(List<ObligationIdentity> before, List<ObligationIdentity> after) {
        Map<String, ObligationIdentity> left = index(before);
        Map<String, ObligationIdentity> right = index(after);

        List<ObligationIdentity> added = new ArrayList<>();
        List<ObligationIdentity> removed = new ArrayList<>();
        List<ObligationIdentity> unchanged = new ArrayList<>();
        List<AlignmentDelta> modified = new ArrayList<>();

        for (Map.Entry<String, ObligationIdentity> entry : right.entrySet()) {
            if (!left.containsKey(entry.getKey())) added.add(entry.getValue());
        }
        for (Map.Entry<String, ObligationIdentity> entry : left.entrySet()) {
            ObligationIdentity counterpart = right.get(entry.getKey());
            if (counterpart == null) {
                removed.add(entry.getValue());
                continue;
            }
            List<FieldChange> changes = changes(metadataView(entry.getValue().atom()), metadataView(counterpart.atom()));
            if (changes.isEmpty()) {
                unchanged.add(entry.getValue());
            } else {
                modified.add(new AlignmentDelta(entry.getKey(), entry.getValue().atom(), counterpart.atom(), changes));
            }
        }
        return new AlignmentReport(added, removed, unchanged, modified);
    }

    /** Normalized fields compared across revisions, keyed by field name. */
    public static Map<String, Object> metadataView(ObligationAtom atom) {
        Map<String, Object> view = new TreeMap<>();
        view.put("actor", ObligationPayloads.normalized(atom.actor()));
        view.put("action", ObligationPayloads.normalized(atom.action()));
        view.put("object", ObligationPayloads.normalized(atom.object()));
        view.put("modality", atom.modality());
        view.put("reference_identities", atom.referenceIdentities());
        view.put("scopes", atom.scopes().stream()
                .map(s -> s.category().wireName() + ":" + s.normalized()).sorted().toList());
        view.put("lifecycle", atom.lifecycle().stream()
                .map(l -> l.kind().wireName() + ":" + l.normalized()).sorted().toList());
        return view;
    }

    public static Map<String, Object> toPayload(AlignmentReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", VERSION);
        payload.put("added", report.added().stream().map(ObligationPayloads::withIdentity).toList());
        payload.put("removed", report.removed().stream().map(ObligationPayloads::withIdentity).toList());
        payload.put("unchanged", report.unchanged().stream().map(ObligationPayloads::withIdentity).toList());
        List<Map<String, Object>> modified = new ArrayList<>();
        for (AlignmentDelta delta : report.modified()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("identity_hash", delta.identityHash());
            m.put("old", ObligationPayloads.toPayload(delta.before()));
            m.put("new", ObligationPayloads.toPayload(delta.after()));
            List<Map<String, Object>> changes = new ArrayList<>();
            for (FieldChange change : delta.changes()) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("field", change.field());
                c.put("old", change.oldValue());
                c.put("new", change.newValue());
                changes.add(c);
            }
            m.put("changes", changes);
            modified.add(m);
        }
        payload.put("modified", modified);
        return payload;
    }

    private static List<FieldChange> changes(Map<String, Object> before, Map<String, Object> after) {
        List<FieldChange> changes = new ArrayList<>();
        for (String field : before.keySet()) {
            if (!Objects.equals(before.get(field), after.get(field))) {
                changes.add(new FieldChange(field, before.get(field), after.get(field)));
            }
        }
        return changes;
    }

    private static Map<String, ObligationIdentity> index(List<ObligationIdentity> identities) {
        return identities.stream().collect(Collectors.toMap(
                ObligationIdentity::identityHash, Function.identity(), (a, b) -> a, TreeMap::new));
    }
}
