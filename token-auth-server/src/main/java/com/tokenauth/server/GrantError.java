package com.tokenauth.server;

import lombok.Getter;

@Getter
public enum GrantError {
    INVALID_CREDENTIALS(Outcome.UNAUTHORIZED, "invalid_credentials"),
    INVALID_GRANT(Outcome.UNAUTHORIZED, "invalid_grant"),
    TOKEN_FAMILY_REVOKED(Outcome.UNAUTHORIZED, "token_family_revoked"),
    INSUFFICIENT_SCOPE(Outcome.FORBIDDEN, "insufficient_scope"),
    CONFLICT(Outcome.RETRYABLE_CONFLICT, "conflict");

    private final Outcome outcome;
    private final String code;

    GrantError(Outcome outcome, String code) {
        this.outcome = outcome;
        this.code = code;
    }
}
