package com.edgegate.common.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * Issues and verifies HMAC-SHA256 bearer tokens.
 * Tokens carry the subject plus roles, tier and permissions claims.
 */
@Slf4j
public class JwtTokenProvider {

    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_TIER = "tier";
    static final String CLAIM_PERMISSIONS = "permissions";

    private final SecretKey secretKey;
    private final long expiryMillis;
    private final String issuer;

    public JwtTokenProvider(String secret, long expirySeconds, String issuer) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException("JWT secret must be at least 32 characters");
        }

        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMillis = expirySeconds * 1000;
        this.issuer = issuer;

        log.info("JwtTokenProvider initialized with expiry: {} seconds, issuer: {}", expirySeconds, issuer);
    }

    public String generate(UserPrincipal principal) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + expiryMillis);

        String token = Jwts.builder()
                .subject(principal.getSubject())
                .claim(CLAIM_ROLES, orEmpty(principal.getRoles()))
                .claim(CLAIM_TIER, principal.getTier())
                .claim(CLAIM_PERMISSIONS, orEmpty(principal.getPermissions()))
                .issuer(issuer)
                .issuedAt(now)
                .expiration(expiry)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for subject: {} with tier: {}", principal.getSubject(), principal.getTier());
        return token;
    }

    /**
     * Verify and parse a token
     * @return principal described by the token's claims
     * @throws JwtException if the token is invalid or expired
     */
    public UserPrincipal verify(String token) throws JwtException {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(issuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            @SuppressWarnings("unchecked")
            List<String> roles = claims.get(CLAIM_ROLES, List.class);
            @SuppressWarnings("unchecked")
            List<String> permissions = claims.get(CLAIM_PERMISSIONS, List.class);

            return UserPrincipal.builder()
                    .subject(claims.getSubject())
                    .roles(orEmpty(roles))
                    .tier(claims.get(CLAIM_TIER, String.class))
                    .permissions(orEmpty(permissions))
                    .build();

        } catch (ExpiredJwtException e) {
            log.warn("JWT token expired: {}", e.getMessage());
            throw new JwtException("Token expired", e);
        } catch (UnsupportedJwtException e) {
            log.warn("Unsupported JWT token: {}", e.getMessage());
            throw new JwtException("Unsupported token format", e);
        } catch (MalformedJwtException e) {
            log.warn("Malformed JWT token: {}", e.getMessage());
            throw new JwtException("Malformed token", e);
        } catch (SecurityException e) {
            log.warn("JWT signature validation failed: {}", e.getMessage());
            throw new JwtException("Invalid token signature", e);
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is empty or null: {}", e.getMessage());
            throw new JwtException("Token is empty or null", e);
        } catch (io.jsonwebtoken.JwtException e) {
            log.warn("JWT token rejected: {}", e.getMessage());
            throw new JwtException("Token validation failed", e);
        }
    }

    public long getExpirySeconds() {
        return expiryMillis / 1000;
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : Collections.emptyList();
    }
}
