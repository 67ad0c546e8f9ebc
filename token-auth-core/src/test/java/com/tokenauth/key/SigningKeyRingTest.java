package com.tokenauth.key;

import static org.junit.Assert.*;

import java.security.KeyPair;
import java.util.Set;

import org.junit.Test;

public class SigningKeyRingTest {

    @Test
    public void testRotationKeepsOldKeysForVerification() {
        SigningKeyRing ring = SigningKeyRing.of(SigningKey.hmac("2026-01", KeyMaterial.generateHmacKey()));

        SigningKeyRing rotated = ring.rotateTo(SigningKey.hmac("2026-02", KeyMaterial.generateHmacKey()));

        assertEquals("2026-01", ring.active().keyId());
        assertEquals("2026-02", rotated.active().keyId());
        assertEquals(Set.of("2026-01", "2026-02"), rotated.keyIds());
        assertTrue(rotated.find("2026-01").isPresent());
    }

    @Test
    public void testRetireDropsKey() {
        SigningKeyRing ring = SigningKeyRing.of(SigningKey.hmac("a", KeyMaterial.generateHmacKey()))
            .rotateTo(SigningKey.hmac("b", KeyMaterial.generateHmacKey()));

        SigningKeyRing retired = ring.retire("a");

        assertFalse(retired.find("a").isPresent());
        assertSame(retired, retired.retire("unknown"));
        assertThrows(IllegalArgumentException.class, () -> retired.retire("b"));
    }

    @Test
    public void testActiveKeyMustSign() {
        KeyPair pair = KeyMaterial.generateRsaKeyPair();

        assertThrows(IllegalArgumentException.class,
            () -> SigningKeyRing.of(SigningKey.verifyOnly("pub", pair.getPublic())));

        SigningKeyRing ring = SigningKeyRing.of(SigningKey.rsa("rsa", pair), SigningKey.verifyOnly("legacy", pair.getPublic()));
        assertFalse(ring.find("legacy").get().canSign());
    }

    @Test
    public void testDuplicateKeyIdRejected() {
        SigningKey key = SigningKey.hmac("dup", KeyMaterial.generateHmacKey());

        assertThrows(IllegalArgumentException.class, () -> SigningKeyRing.of(key, key));
        assertThrows(IllegalArgumentException.class, () -> SigningKeyRing.of(key).rotateTo(key));
    }

    @Test
    public void testFindNullKeyId() {
        SigningKeyRing ring = SigningKeyRing.of(SigningKey.hmac("a", KeyMaterial.generateHmacKey()));

        assertFalse(ring.find(null).isPresent());
    }
}
