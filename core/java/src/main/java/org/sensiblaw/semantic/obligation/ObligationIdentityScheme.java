package org.sensiblaw.semantic.obligation;

import java.util.List;

/**
 * A named, versioned obligation identity function. Identities are computed over a whole
 * document because duplicates are told apart by their occurrence position.
 */
public interface ObligationIdentityScheme {

    String name();

    /** Identities in the order of {@code atoms}. */
    List<ObligationIdentity> identify(List<ObligationAtom> atoms);
}
