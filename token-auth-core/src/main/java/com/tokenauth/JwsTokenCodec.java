package com.tokenauth;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.tokenauth.key.SigningKey;
import com.tokenauth.key.SigningKeyRing;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.SecurityException;

/**
 * JWS compact tokens ({@code header.payload.signature}) signed with the active key of a
 * {@link SigningKeyRing}. The key id travels in the {@code kid} header so tokens signed
 * before a rotation still verify.
 */
public final class JwsTokenCodec implements TokenCodec {

    static final String CLAIM_SCOPES = "scp";
    static final String CLAIM_FAMILY = "fam";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private final SigningKeyRing keyRing;
    private final String issuer;
    private final Clock clock;
    private final long skewSeconds;
    private final JwtParser parser;

    public JwsTokenCodec(SigningKeyRing keyRing, TokenAuthConfig config, Clock clock) {
        this.keyRing = keyRing;
        this.issuer = config.getIssuer();
        this.clock = clock;
        this.skewSeconds = config.getClockSkew().toSeconds();
        this.parser = Jwts.parser()
            .keyLocator(new KeyRingLocator(keyRing))
            .requireIssuer(issuer)
            .clock(() -> Date.from(clock.instant()))
            .clockSkewSeconds(skewSeconds)
            .build();
    }

    @Override
    public IssuedToken issue(TokenClaims claims) {
        validate(claims);
        SigningKey key = keyRing.active();
        try {
            String token = Jwts.builder()
                .header().keyId(key.keyId()).and()
                .issuer(issuer)
                .subject(claims.subjectId())
                .id(claims.tokenId())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_SCOPES, List.copyOf(new TreeSet<>(claims.scopes())))
                .claim(CLAIM_FAMILY, claims.tokenFamilyId())
                .claim(CLAIM_TOKEN_TYPE, claims.tokenType().claimValue())
                .signWith(key.signingKey())
                .compact();
            return new IssuedToken(token, claims);
        } catch (JwtException e) {
            throw new TokenEncodingException("Failed to sign token with key " + key.keyId(), e);
        }
    }

    @Override
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Token is empty");
        }
        checkStructure(token);

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (TokenVerificationException e) {
            throw e;
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(RejectionReason.EXPIRED, "Token expired", e);
        } catch (SecurityException e) {
            throw new TokenVerificationException(RejectionReason.SIGNATURE_INVALID, "Signature verification failed", e);
        } catch (JwtException | IllegalArgumentException e) {
            if (e.getCause() instanceof TokenVerificationException located) throw located;
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Token cannot be parsed: " + e.getMessage(), e);
        }

        TokenClaims decoded = toTokenClaims(claims);
        // the parser only rejects once now - skew is strictly past exp; expiry is inclusive
        if (!clock.instant().isBefore(decoded.expiresAt().plusSeconds(skewSeconds))) {
            throw new TokenVerificationException(RejectionReason.EXPIRED, "Token expired");
        }
        return decoded;
    }

    private static void validate(TokenClaims claims) {
        if (claims == null) throw new TokenEncodingException("Claims are required");
        if (claims.subjectId() == null || claims.subjectId().isBlank()) throw new TokenEncodingException("subject_id is required");
        if (claims.tokenFamilyId() == null || claims.tokenFamilyId().isBlank()) throw new TokenEncodingException("token_family_id is required");
        if (claims.tokenId() == null || claims.tokenId().isBlank()) throw new TokenEncodingException("token id is required");
        if (claims.tokenType() == null) throw new TokenEncodingException("token_type is required");
        if (claims.issuedAt() == null || claims.expiresAt() == null) throw new TokenEncodingException("issued_at and expires_at are required");
        if (!claims.expiresAt().isAfter(claims.issuedAt())) throw new TokenEncodingException("Token lifetime must be positive");
    }

    /**
     * Header and payload must decode to JSON objects before the signature segment is looked at,
     * so garbage is reported as malformed whatever its last segment holds.
     */
    private static void checkStructure(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || !isJsonObjectSegment(parts[0]) || !isJsonObjectSegment(parts[1])) {
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Token is not a three-segment JWS");
        }
        // signatures differing only in the unused bits of the last character are not the signature we issued
        if (!isCanonicalBase64Url(parts[2])) {
            throw new TokenVerificationException(RejectionReason.SIGNATURE_INVALID, "Signature segment is not canonical base64url");
        }
    }

    private static boolean isJsonObjectSegment(String segment) {
        if (!isCanonicalBase64Url(segment)) return false;
        String json = new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8).strip();
        return json.startsWith("{") && json.endsWith("}");
    }

    private static boolean isCanonicalBase64Url(String segment) {
        if (segment.isEmpty()) return false;
        try {
            byte[] raw = Base64.getUrlDecoder().decode(segment);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(raw).equals(segment);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        TokenType type = TokenType.fromClaim(claims.get(CLAIM_TOKEN_TYPE))
            .orElseThrow(() -> new TokenVerificationException(RejectionReason.MALFORMED, "Missing or unknown token_type"));
        Object family = claims.get(CLAIM_FAMILY);
        if (family == null || family.toString().isBlank()) {
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Missing token family");
        }
        if (claims.getSubject() == null || claims.getIssuedAt() == null || claims.getExpiration() == null || claims.getId() == null) {
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Missing registered claims");
        }
        return new TokenClaims(
            claims.getSubject(),
            scopes(claims.get(CLAIM_SCOPES)),
            claims.getIssuedAt().toInstant(),
            claims.getExpiration().toInstant(),
            family.toString(),
            type,
            claims.getId()
        );
    }

    private static Set<String> scopes(Object raw) {
        if (raw == null) return Set.of();
        if (!(raw instanceof Collection<?> values)) {
            throw new TokenVerificationException(RejectionReason.MALFORMED, "Scopes claim must be an array");
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) scopes.add(value.toString());
        }
        return scopes;
    }

    private static final class KeyRingLocator extends LocatorAdapter<Key> {
        private final SigningKeyRing keyRing;

        KeyRingLocator(SigningKeyRing keyRing) {
            this.keyRing = keyRing;
        }

        @Override
        protected Key locate(JwsHeader header) {
            return keyRing.find(header.getKeyId())
                .map(SigningKey::verificationKey)
                .orElseThrow(() -> new TokenVerificationException(RejectionReason.SIGNATURE_INVALID,
                    "Unknown signing key id " + header.getKeyId()));
        }
    }
}
