package com.tokenauth;

import java.util.Objects;
import java.util.Set;

/**
 * An authenticated subject and the scopes granted to it.
 * Owned by the identity store; this library only reads it.
 */
public record Principal(String subjectId, Set<String> scopes) {

    public Principal {
        Objects.requireNonNull(subjectId, "subjectId");
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
