package com.intteq.broker.rpc.tasks;

import com.intteq.broker.rpc.dispatch.Authenticator;
import com.intteq.broker.rpc.dispatch.Principal;
import com.intteq.broker.rpc.exception.AuthenticationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a bearer token ({@code "Bearer <jwt>"} or the bare token) to the user it
 * was issued for.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticator implements Authenticator {

    private static final String BEARER = "bearer ";

    private final TokenService tokens;
    private final UserRepository users;

    @Override
    public Principal resolve(String credential) {
        String token = credential.strip();
        if (token.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            token = token.substring(BEARER.length()).strip();
        }

        Claims claims;
        try {
            claims = tokens.verify(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new AuthenticationException("Invalid token");
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException("Invalid token payload (no sub)");
        }

        long userId;
        try {
            userId = Long.parseLong(subject);
        } catch (NumberFormatException e) {
            throw new AuthenticationException("Invalid token");
        }

        UserEntity user = users.findById(userId)
                .orElseThrow(() -> new AuthenticationException("User not found"));
        return new Principal(user.getId(), user.getEmail());
    }
}
