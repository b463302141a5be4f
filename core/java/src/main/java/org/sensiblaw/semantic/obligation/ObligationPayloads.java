package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.model.TextSpan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes for obligation atoms. {@link #identityPayload} is the hash input of the
 * obligation identity; {@link #toPayload} is the {@code obligation.v1} record.
 */
public final class ObligationPayloads {

    public static final String VERSION = "obligation.v1";

    private ObligationPayloads() {}

    /**
     * Fields that define what an obligation says. Spans, clause ids, labels, pages, scopes
     * and lifecycle are left out.
     */
    public static Map<String, Object> identityPayload(ObligationAtom atom) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", atom.type().wireName());
        payload.put("modality", atom.modality());
        payload.put("actor", normalized(atom.actor()));
        payload.put("action", normalized(atom.action()));
        payload.put("object", normalized(atom.object()));
        payload.put("conditions", atom.conditions().stream().map(c -> c.type().wireName()).sorted().toList());
        payload.put("reference_identities", atom.referenceIdentities());
        return payload;
    }

    public static Map<String, Object> toPayload(ObligationAtom atom) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", VERSION);
        payload.put("type", atom.type().wireName());
        payload.put("modality", atom.modality());
        payload.put("clause_id", atom.clauseId());
        payload.put("actor", phrase(atom.actor()));
        payload.put("action", phrase(atom.action()));
        payload.put("object", phrase(atom.object()));
        payload.put("conditions", atom.conditions().stream().map(ObligationPayloads::condition).toList());
        payload.put("scope", scope(atom));
        payload.put("scopes", atom.scopes().stream().map(ObligationPayloads::scope).toList());
        payload.put("lifecycle", atom.lifecycle().stream().map(ObligationPayloads::lifecycle).toList());
        payload.put("reference_identities", atom.referenceIdentities());
        payload.put("span", span(atom.span()));
        payload.put("provenance", provenance(atom.provenance()));
        return payload;
    }

    public static Map<String, Object> withIdentity(ObligationIdentity identity) {
        Map<String, Object> payload = toPayload(identity.atom());
        payload.put("obl_id", identity.identityHash());
        return payload;
    }

    static String normalized(PhraseAtom phrase) {
        return phrase != null ? phrase.normalized() : null;
    }

    private static Map<String, Object> phrase(PhraseAtom phrase) {
        if (phrase == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("text", phrase.text());
        m.put("normalized", phrase.normalized());
        m.put("span", span(phrase.span()));
        m.put("clause_id", phrase.clauseId());
        return m;
    }

    private static Map<String, Object> condition(ConditionAtom condition) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", condition.type().wireName());
        m.put("text", condition.text());
        m.put("normalized", condition.normalized());
        m.put("span", span(condition.span()));
        m.put("clause_id", condition.clauseId());
        return m;
    }

    /** One slot per category: {@code {time, place, context}}. */
    private static Map<String, Object> scope(ObligationAtom atom) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (ScopeCategory category : ScopeCategory.values()) {
            m.put(category.wireName(), atom.scope(category).map(ScopeAtom::normalized).orElse(null));
        }
        return m;
    }

    private static Map<String, Object> scope(ScopeAtom scope) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("category", scope.category().wireName());
        m.put("text", scope.text());
        m.put("normalized", scope.normalized());
        m.put("span", span(scope.span()));
        m.put("clause_id", scope.clauseId());
        return m;
    }

    private static Map<String, Object> lifecycle(LifecycleTrigger trigger) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("kind", trigger.kind().wireName());
        m.put("text", trigger.text());
        m.put("normalized", trigger.normalized());
        m.put("span", span(trigger.span()));
        m.put("clause_id", trigger.clauseId());
        return m;
    }

    private static List<Integer> span(TextSpan span) {
        return span != null ? List.of(span.start(), span.end()) : null;
    }

    private static Map<String, Object> provenance(ObligationProvenance p) {
        if (p == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source_id", p.sourceId());
        m.put("rev_id", p.revId());
        m.put("clause_index", p.clauseIndex());
        m.put("clause_label", p.clauseLabel());
        m.put("pages", p.pages());
        m.put("anchor_used", p.anchorUsed());
        return m;
    }
}
