package com.tokenauth.server;

import java.util.Set;

import com.tokenauth.IssuedToken;

/**
 * Access and refresh token issued together; both belong to the same token family.
 */
public record TokenPair(IssuedToken access, IssuedToken refresh) {

    public String accessToken() {
        return access.value();
    }

    public String refreshToken() {
        return refresh.value();
    }

    public String tokenFamilyId() {
        return access.claims().tokenFamilyId();
    }

    public Set<String> scopes() {
        return access.claims().scopes();
    }
}
