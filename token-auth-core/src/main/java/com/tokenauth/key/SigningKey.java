package com.tokenauth.key;

import java.security.Key;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Objects;
import javax.crypto.SecretKey;

/**
 * A key identified by the {@code kid} header. Keys without a signing half only verify.
 */
public record SigningKey(String keyId, Key signingKey, Key verificationKey) {

    public SigningKey {
        if (keyId == null || keyId.isBlank()) throw new IllegalArgumentException("keyId must not be blank");
        Objects.requireNonNull(verificationKey, "verificationKey");
    }

    public static SigningKey hmac(String keyId, SecretKey secret) {
        return new SigningKey(keyId, secret, secret);
    }

    public static SigningKey rsa(String keyId, KeyPair keyPair) {
        return new SigningKey(keyId, keyPair.getPrivate(), keyPair.getPublic());
    }

    public static SigningKey verifyOnly(String keyId, PublicKey publicKey) {
        return new SigningKey(keyId, null, publicKey);
    }

    public boolean canSign() {
        return signingKey != null;
    }

    @Override
    public String toString() {
        return "SigningKey[kid=" + keyId + ", alg=" + verificationKey.getAlgorithm() + ", signing=" + canSign() + "]";
    }
}
