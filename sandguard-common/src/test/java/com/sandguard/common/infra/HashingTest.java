package com.sandguard.common.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashingTest {

    @Test
    void knownDigest() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                Hashing.sha256Hex("hello"));
    }

    @Test
    void nullHashesLikeEmpty() {
        assertEquals(Hashing.sha256Hex(""), Hashing.sha256Hex(null));
        assertEquals(64, Hashing.sha256Hex(null).length());
    }

    @Test
    void sameSizeDifferentContentDiffers() {
        assertNotEquals(Hashing.sha256Hex("[\"curl\"]"), Hashing.sha256Hex("[\"wget\"]"));
    }
}
