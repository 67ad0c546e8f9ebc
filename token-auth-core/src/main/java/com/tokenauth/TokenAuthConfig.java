package com.tokenauth;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Process-wide token settings. Built once at startup and immutable thereafter.
 * <p>
 * Unset values fall back to the defaults below. Durations read from {@link Properties}
 * use ISO-8601 notation, e.g. {@code PT15M} or {@code P30D}.
 */
@Getter
@ToString
public final class TokenAuthConfig {

    public static final String PREFIX = "token-auth.";

    public static final String DEFAULT_ISSUER = "token-auth";
    public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REFRESH_TOKEN_TTL = Duration.ofDays(30);
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(10);

    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration clockSkew;
    private final boolean accessTokenBlacklistEnabled;
    private final Duration cleanupInterval;

    @Builder(toBuilder = true)
    private TokenAuthConfig(String issuer,
                            Duration accessTokenTtl,
                            Duration refreshTokenTtl,
                            Duration clockSkew,
                            boolean accessTokenBlacklistEnabled,
                            Duration cleanupInterval) {
        this.issuer = (issuer == null || issuer.isBlank()) ? DEFAULT_ISSUER : issuer.trim();
        this.accessTokenTtl = accessTokenTtl == null ? DEFAULT_ACCESS_TOKEN_TTL : accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl == null ? DEFAULT_REFRESH_TOKEN_TTL : refreshTokenTtl;
        this.clockSkew = clockSkew == null ? DEFAULT_CLOCK_SKEW : clockSkew;
        this.accessTokenBlacklistEnabled = accessTokenBlacklistEnabled;
        this.cleanupInterval = cleanupInterval == null ? DEFAULT_CLEANUP_INTERVAL : cleanupInterval;

        requirePositive(this.accessTokenTtl, "accessTokenTtl");
        requirePositive(this.refreshTokenTtl, "refreshTokenTtl");
        requirePositive(this.cleanupInterval, "cleanupInterval");
        if (this.clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
        if (this.accessTokenTtl.compareTo(this.refreshTokenTtl) >= 0) {
            throw new IllegalArgumentException("accessTokenTtl must be shorter than refreshTokenTtl");
        }
    }

    public static TokenAuthConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code token-auth.*} keys; anything absent keeps its default.
     */
    public static TokenAuthConfig fromProperties(Properties props) {
        return builder()
            .issuer(props.getProperty(PREFIX + "issuer"))
            .accessTokenTtl(duration(props, "access-token-ttl"))
            .refreshTokenTtl(duration(props, "refresh-token-ttl"))
            .clockSkew(duration(props, "clock-skew"))
            .accessTokenBlacklistEnabled(Boolean.parseBoolean(props.getProperty(PREFIX + "access-token-blacklist", "false")))
            .cleanupInterval(duration(props, "cleanup-interval"))
            .build();
    }

    private static Duration duration(Properties props, String key) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Duration.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
