package org.sensiblaw.semantic.obligation;

import org.sensiblaw.semantic.identity.IdentityHashing;
import org.sensiblaw.semantic.json.CanonicalJson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code obl_id_v1}: {@code sha256(obl_id_v1 ␟ canonical-json(identity payload) ␟ position)}.
 *
 * <p>The position is the occurrence ordinal among earlier atoms with an identical payload,
 * so renumbering, reordering or inserting unrelated clauses leaves every hash alone while
 * genuine duplicates still get distinct ids.
 */
public final class OblIdV1 implements ObligationIdentityScheme {

    public static final String NAME = "obl_id_v1";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ObligationIdentity> identify(List<ObligationAtom> atoms) {
        Map<String, Integer> occurrences = new HashMap<>();
        List<ObligationIdentity> identities = new ArrayList<>(atoms.size());
        for (ObligationAtom atom : atoms) {
            String canonical = CanonicalJson.write(ObligationPayloads.identityPayload(atom));
            int position = occurrences.merge(canonical, 1, Integer::sum) - 1;
            String hash = IdentityHashing.hashParts(NAME, canonical, Integer.toString(position));
            identities.add(new ObligationIdentity(hash, position, atom));
        }
        return identities;
    }
}
