package com.tokenauth.key;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of keys: one active key signs new tokens, every key in the ring verifies.
 * <p>
 * Rotation produces a new ring; tokens signed by a previous key keep verifying until that
 * key is retired.
 */
public final class SigningKeyRing {

    private final String activeKeyId;
    private final Map<String, SigningKey> keys;

    private SigningKeyRing(String activeKeyId, Map<String, SigningKey> keys) {
        SigningKey active = keys.get(activeKeyId);
        if (active == null) throw new IllegalArgumentException("Active key " + activeKeyId + " is not in the ring");
        if (!active.canSign()) throw new IllegalArgumentException("Active key " + activeKeyId + " has no signing key");
        this.activeKeyId = activeKeyId;
        this.keys = Collections.unmodifiableMap(keys);
    }

    public static SigningKeyRing of(SigningKey active, SigningKey... verificationOnly) {
        Map<String, SigningKey> keys = new LinkedHashMap<>();
        keys.put(active.keyId(), active);
        for (SigningKey key : verificationOnly) {
            if (keys.putIfAbsent(key.keyId(), key) != null) {
                throw new IllegalArgumentException("Duplicate key id " + key.keyId());
            }
        }
        return new SigningKeyRing(active.keyId(), keys);
    }

    public SigningKey active() {
        return keys.get(activeKeyId);
    }

    public Optional<SigningKey> find(String keyId) {
        return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId));
    }

    public Set<String> keyIds() {
        return keys.keySet();
    }

    /**
     * Returns a ring that signs with {@code next} and still verifies with every current key.
     */
    public SigningKeyRing rotateTo(SigningKey next) {
        if (keys.containsKey(next.keyId())) throw new IllegalArgumentException("Duplicate key id " + next.keyId());
        Map<String, SigningKey> copy = new LinkedHashMap<>(keys);
        copy.put(next.keyId(), next);
        return new SigningKeyRing(next.keyId(), copy);
    }

    public SigningKeyRing retire(String keyId) {
        if (activeKeyId.equals(keyId)) throw new IllegalArgumentException("Cannot retire the active key " + keyId);
        if (!keys.containsKey(keyId)) return this;
        Map<String, SigningKey> copy = new LinkedHashMap<>(keys);
        copy.remove(keyId);
        return new SigningKeyRing(activeKeyId, copy);
    }
}
