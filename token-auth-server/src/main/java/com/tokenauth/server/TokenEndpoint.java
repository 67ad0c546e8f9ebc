package com.tokenauth.server;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Request handling for the login, refresh and logout routes, independent of any web framework.
 * Request and response bodies bind with Jackson; failures come back as {@link TokenResult.Error}
 * carrying only a status and a public error code.
 */
@Slf4j
@AllArgsConstructor
public class TokenEndpoint {

    public record LoginRequest(
        @JsonProperty("username") String identifier,
        @JsonProperty("password") String secret,
        @JsonProperty("scope") String scope
    ) {}

    public record RefreshRequest(@JsonProperty("refresh_token") String refreshToken) {}

    public record LogoutRequest(@JsonProperty("refresh_token") String refreshToken) {}

    public record ErrorBody(@JsonProperty("error") String error) {}

    public sealed interface TokenResult {
        record Success(TokenResponse body) implements TokenResult {
        }
        record LoggedOut() implements TokenResult {
        }
        record Error(int httpStatus, String errorCode) implements TokenResult {
            public ErrorBody body() {
                return new ErrorBody(errorCode);
            }
        }

        default int httpStatus() {
            return this instanceof LoggedOut ? 204 : 200;
        }
    }

    private static final TokenResult INVALID_REQUEST = new TokenResult.Error(400, "invalid_request");

    private final GrantEngine grantEngine;

    public TokenResult login(LoginRequest req) {
        if (req == null || isBlank(req.identifier()) || isBlank(req.secret())) return INVALID_REQUEST;
        try {
            return new TokenResult.Success(TokenResponse.from(
                grantEngine.passwordGrant(req.identifier(), req.secret(), parseScope(req.scope()))));
        } catch (GrantException e) {
            return failure("login", e);
        }
    }

    public TokenResult refresh(RefreshRequest req) {
        if (req == null || isBlank(req.refreshToken())) return INVALID_REQUEST;
        try {
            return new TokenResult.Success(TokenResponse.from(grantEngine.refreshGrant(req.refreshToken())));
        } catch (GrantException e) {
            return failure("refresh", e);
        }
    }

    public TokenResult logout(LogoutRequest req) {
        if (req == null || isBlank(req.refreshToken())) return INVALID_REQUEST;
        try {
            grantEngine.logoutWithRefreshToken(req.refreshToken());
            return new TokenResult.LoggedOut();
        } catch (GrantException e) {
            return failure("logout", e);
        }
    }

    private static TokenResult failure(String route, GrantException e) {
        log.debug("{} refused: {} ({})", route, e.getError(), e.getMessage());
        return new TokenResult.Error(e.getOutcome().httpStatus(), e.getError().getCode());
    }

    private static Set<String> parseScope(String scope) {
        if (scope == null || scope.isBlank()) return Set.of();
        return Arrays.stream(scope.trim().split("\\s+"))
            .filter(s -> !s.isBlank())
            .collect(Collectors.toSet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
