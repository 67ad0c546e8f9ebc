package com.tokenauth.key;

import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import javax.crypto.SecretKey;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;

/**
 * Loads and generates the keys a {@link SigningKeyRing} is built from.
 */
public final class KeyMaterial {
    private KeyMaterial() {}

    /**
     * HMAC key from a base64 encoded secret of at least 256 bits.
     */
    public static SecretKey hmacSecret(String base64Secret) {
        if (base64Secret == null || base64Secret.isBlank()) {
            throw new IllegalArgumentException("HMAC secret must not be blank");
        }
        try {
            return Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64Secret.trim()));
        } catch (DecodingException e) {
            throw new IllegalArgumentException("HMAC secret is not valid base64", e);
        } catch (WeakKeyException e) {
            throw new IllegalArgumentException("HMAC secret is too short: " + e.getMessage(), e);
        }
    }

    public static SecretKey generateHmacKey() {
        return Jwts.SIG.HS256.key().build();
    }

    public static KeyPair generateRsaKeyPair() {
        return Jwts.SIG.RS256.keyPair().build();
    }

    public static KeyPair loadRsaKeyPair(String publicPem, String privatePem) {
        return new KeyPair(loadPublicKey(publicPem), loadPrivateKey(privatePem));
    }

    public static PrivateKey loadPrivateKey(String pem) {
        try {
            byte[] der = pemBody(pem, "PRIVATE KEY");
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalArgumentException("Failed to parse RSA private key from PEM", e);
        }
    }

    public static PublicKey loadPublicKey(String pem) {
        try {
            byte[] der = pemBody(pem, "PUBLIC KEY");
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalArgumentException("Failed to parse RSA public key from PEM", e);
        }
    }

    public static String toPem(PublicKey key) {
        return pem("PUBLIC KEY", key.getEncoded());
    }

    public static String toPem(PrivateKey key) {
        return pem("PRIVATE KEY", key.getEncoded());
    }

    private static byte[] pemBody(String pem, String type) {
        if (pem == null || !pem.contains("-----BEGIN " + type + "-----")) {
            throw new IllegalArgumentException("Expected a PEM block of type " + type);
        }
        String body = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
        try {
            return Base64.getDecoder().decode(body.getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("PEM body of type " + type + " is not valid base64", e);
        }
    }

    private static String pem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }
}
