package org.sensiblaw.semantic.reference;

/**
 * A named, versioned canonicalization of references into identities. Changing the
 * normalization rules means adding a new scheme, so historical hashes stay reproducible.
 */
public interface ReferenceIdentityScheme {

    /** Scheme name, also mixed into every hash, e.g. {@code cr_id_v1}. */
    String name();

    ReferenceIdentity identify(Reference reference);
}
