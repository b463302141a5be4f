package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.identity.IdentityDiff;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-way OBL-ID set difference between two revisions, each list sorted by hash.
 */
public record ObligationDiff(List<String> added, List<String> removed, List<String> unchanged) {

    public static final String VERSION = "obligation.diff.v1";

    public ObligationDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        unchanged = List.copyOf(unchanged);
    }

    public static ObligationDiff of(Collection<ObligationIdentity> before, Collection<ObligationIdentity> after) {
        IdentityDiff diff = IdentityDiff.of(
                before.stream().map(ObligationIdentity::identityHash).toList(),
                after.stream().map(ObligationIdentity::identityHash).toList());
        return new ObligationDiff(diff.added(), diff.removed(), diff.unchanged());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", VERSION);
        payload.put("added", added);
        payload.put("removed", removed);
        payload.put("unchanged", unchanged);
        return payload;
    }
}
