package com.tokenauth;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies access tokens through the codec alone, plus the blacklist when it is enabled.
 * Refresh tokens are not accepted here.
 */
@Slf4j
@AllArgsConstructor
public class AccessTokenAuthenticator implements TokenAuthenticator {

    private final TokenCodec codec;
    private final AccessTokenBlacklist blacklist;

    public AccessTokenAuthenticator(TokenCodec codec) {
        this(codec, AccessTokenBlacklist.disabled());
    }

    @Override
    public AuthenticationResult authenticate(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) return new AuthenticationResult.Rejected(RejectionReason.MISSING);

        TokenClaims claims;
        try {
            claims = codec.verify(rawToken.trim());
        } catch (TokenVerificationException e) {
            log.debug("Rejected access token: {} ({})", e.getReason(), e.getMessage());
            return new AuthenticationResult.Rejected(e.getReason());
        }

        if (claims.tokenType() != TokenType.ACCESS) {
            log.debug("Rejected {} token presented as access token, family {}", claims.tokenType(), claims.tokenFamilyId());
            return new AuthenticationResult.Rejected(RejectionReason.MALFORMED);
        }
        if (blacklist.isRevoked(claims)) {
            log.debug("Rejected blacklisted access token of family {}", claims.tokenFamilyId());
            return new AuthenticationResult.Rejected(RejectionReason.REVOKED);
        }
        return new AuthenticationResult.Authenticated(claims.toPrincipal(), claims);
    }
}
