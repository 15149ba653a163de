package com.edgegate.gateway.security;

import com.edgegate.common.security.JwtException;
import com.edgegate.common.security.JwtTokenProvider;
import com.edgegate.common.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns bearer credentials into a {@link UserPrincipal}
 */
@Slf4j
@Component
public class PrincipalResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;

    public PrincipalResolver(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    /**
     * Token from an Authorization header value, if it is a bearer credential
     */
    public static Optional<String> bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Verify a token
     * @return the principal, or empty when the token is invalid or expired
     */
    public Optional<UserPrincipal> verify(String token) {
        try {
            return Optional.of(tokenProvider.verify(token));
        } catch (JwtException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Principal for an optional token; missing or invalid tokens resolve to anonymous
     */
    public UserPrincipal resolveOrAnonymous(String token) {
        if (token == null || token.isEmpty()) {
            return UserPrincipal.anonymous();
        }
        return verify(token).orElseGet(UserPrincipal::anonymous);
    }
}
