package com.tokenauth;

import java.time.Clock;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

/**
 * Opt-in revocation of access tokens, by token family or by individual token id.
 * <p>
 * Enabling it gives up store-free access-token verification in exchange for immediate
 * revocation. When disabled, revocations are ignored and no token is ever reported revoked.
 */
@Slf4j
public class AccessTokenBlacklist {

    private static final String FAMILY_PREFIX = "fam:";
    private static final String TOKEN_PREFIX = "jti:";

    private final TokenBlacklist store;
    private final Clock clock;
    private final boolean enabled;

    public AccessTokenBlacklist(TokenBlacklist store, Clock clock, boolean enabled) {
        this.store = store;
        this.clock = clock;
        this.enabled = enabled && store != null;
    }

    /**
     * Enabled only when {@code token-auth.access-token-blacklist} is set in {@code config}.
     */
    public static AccessTokenBlacklist from(TokenBlacklist store, Clock clock, TokenAuthConfig config) {
        return new AccessTokenBlacklist(store, clock, config.isAccessTokenBlacklistEnabled());
    }

    public static AccessTokenBlacklist disabled() {
        return new AccessTokenBlacklist(null, Clock.systemUTC(), false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Blacklists every token of a family until {@code until}, normally the moment the
     * last access token of that family expires.
     */
    public void revokeFamily(String tokenFamilyId, Instant until) {
        if (!enabled) return;
        store.add(FAMILY_PREFIX + tokenFamilyId, until);
        log.debug("Blacklisted token family {} until {}", tokenFamilyId, until);
    }

    public void revokeToken(String tokenId, Instant until) {
        if (!enabled) return;
        store.add(TOKEN_PREFIX + tokenId, until);
        log.debug("Blacklisted token {} until {}", tokenId, until);
    }

    public boolean isRevoked(TokenClaims claims) {
        if (!enabled) return false;
        Instant now = clock.instant();
        return store.contains(FAMILY_PREFIX + claims.tokenFamilyId(), now)
            || store.contains(TOKEN_PREFIX + claims.tokenId(), now);
    }

    public int purgeExpired() {
        return enabled ? store.purgeExpired(clock.instant()) : 0;
    }
}
