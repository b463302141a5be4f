package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.identity.IdentityDiff;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity computation over reference lists, CR-ID diffs, and their JSON payloads.
 */
public final class ReferenceIdentities {

    public static final String VERSION = "reference.identity.v1";

    private ReferenceIdentities() {}

    public static List<ReferenceIdentity> identify(List<Reference> references, ReferenceIdentityScheme scheme) {
        return references.stream().map(scheme::identify).toList();
    }

    /** Three-way set difference over identity hashes; provenance plays no part. */
    public static IdentityDiff diff(Collection<ReferenceIdentity> before, Collection<ReferenceIdentity> after) {
        return IdentityDiff.of(
                before.stream().map(ReferenceIdentity::identityHash).toList(),
                after.stream().map(ReferenceIdentity::identityHash).toList());
    }

    public static Map<String, Object> toPayload(ReferenceIdentity identity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", VERSION);
        payload.put("identity_hash", identity.identityHash());
        payload.put("family_key", identity.familyKey());
        payload.put("year", identity.year());
        payload.put("jurisdiction_hint", identity.jurisdictionHint());
        ReferenceProvenance p = identity.provenance();
        if (p != null) {
            Map<String, Object> provenance = new LinkedHashMap<>();
            provenance.put("clause_id", p.clauseId());
            provenance.put("page", p.pages().isEmpty() ? null : p.pages());
            provenance.put("source", p.source());
            provenance.put("anchor_used", p.anchorUsed());
            payload.put("provenance", provenance);
        }
        return payload;
    }

    public static Map<String, Object> diffPayload(IdentityDiff diff) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("added", diff.added());
        payload.put("removed", diff.removed());
        payload.put("unchanged", diff.unchanged());
        return payload;
    }
}
