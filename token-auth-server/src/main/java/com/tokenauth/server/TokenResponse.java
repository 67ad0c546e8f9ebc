package com.tokenauth.server;

import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a successful login or refresh.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("refresh_expires_in") long refreshExpiresIn,
    @JsonProperty("scope") String scope
) {

    public static TokenResponse from(TokenPair pair) {
        String scope = pair.scopes().isEmpty() ? null : String.join(" ", new TreeSet<>(pair.scopes()));
        return new TokenResponse(
            pair.accessToken(),
            "Bearer",
            pair.access().expiresInSeconds(),
            pair.refreshToken(),
            pair.refresh().expiresInSeconds(),
            scope
        );
    }

    @Override
    public String toString() {
        return "TokenResponse[token_type=" + tokenType + ", expires_in=" + expiresIn + ", scope=" + scope + "]";
    }
}
