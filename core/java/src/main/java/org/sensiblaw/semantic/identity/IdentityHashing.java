package org.sensiblaw.semantic.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for identity hashes. Identity parts are joined with the ASCII unit
 * separator so that no field value can forge a boundary.
 */
public final class IdentityHashing {

    public static final String SEPARATOR = "\u001f";

    private IdentityHashing() {}

    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Hash of the parts joined by {@link #SEPARATOR}; null parts hash as empty strings. */
    public static String hashParts(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(parts[i] == null ? "" : parts[i]);
        }
        return sha256Hex(sb.toString());
    }
}
