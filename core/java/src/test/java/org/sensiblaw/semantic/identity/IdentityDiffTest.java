package org.sensiblaw.semantic.identity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentityDiffTest {

    @Test
    void partitionsAndSortsHashes() {
        IdentityDiff diff = IdentityDiff.of(List.of("c", "a", "b"), List.of("d", "b", "a"));
        assertEquals(List.of("d"), diff.added());
        assertEquals(List.of("c"), diff.removed());
        assertEquals(List.of("a", "b"), diff.unchanged());
        assertFalse(diff.isEmpty());
    }

    @Test
    void duplicatesAndOrderDoNotMatter() {
        IdentityDiff diff = IdentityDiff.of(List.of("b", "a", "a"), List.of("a", "b"));
        assertTrue(diff.isEmpty());
        assertEquals(List.of("a", "b"), diff.unchanged());
    }

    @Test
    void hashPartsSeparatesFields() {
        assertNotEquals(IdentityHashing.hashParts("ab", "c"), IdentityHashing.hashParts("a", "bc"));
        assertEquals(IdentityHashing.hashParts("a", null), IdentityHashing.hashParts("a", ""));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                IdentityHashing.sha256Hex(""));
    }
}
