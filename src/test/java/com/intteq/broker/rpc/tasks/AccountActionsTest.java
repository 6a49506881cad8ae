package com.intteq.broker.rpc.tasks;

import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import com.intteq.broker.rpc.exception.AuthenticationException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

@DataJpaTest
@ActiveProfiles("test")
public class AccountActionsTest {

    private static final String EMAIL = "student@example.com";
    private static final String PASSWORD = "qwerty123";

    @Autowired
    private AccountActions accounts;

    @Autowired
    private JwtAuthenticator authenticator;

    @Autowired
    private TokenService tokens;

    @Autowired
    private SecurityProperties securityProperties;

    @Autowired
    private UserRepository users;

    private HandlerResult register() {
        return accounts.register(null, "v1", Map.of("email", EMAIL, "password", PASSWORD, "full_name", "Demo Student"));
    }

    private String login() {
        HandlerResult result = accounts.login(null, "v1", Map.of("email", EMAIL, "password", PASSWORD));
        Assertions.assertNull(result.error());
        Map<?, ?> data = (Map<?, ?>) result.data();
        Assertions.assertEquals("bearer", data.get("token_type"));
        return (String) data.get("access_token");
    }

    @Test
    public void registerStoresHashedPassword() {
        Map<?, ?> data = (Map<?, ?>) register().data();

        Assertions.assertEquals(EMAIL, data.get("email"));
        Assertions.assertEquals("Demo Student", data.get("full_name"));
        UserEntity user = users.findByEmail(EMAIL).orElseThrow();
        Assertions.assertEquals(user.getId(), data.get("id"));
        Assertions.assertNotEquals(PASSWORD, user.getPasswordHash());
    }

    @Test
    public void registerRejectsDuplicatesAndMissingFields() {
        register();

        Assertions.assertEquals("User already exists", register().error());
        Assertions.assertEquals("email/password/full_name required",
                accounts.register(null, "v1", Map.of("email", EMAIL)).error());
    }

    @Test
    public void loginChecksPassword() {
        register();

        Assertions.assertEquals("Incorrect email or password",
                accounts.login(null, "v1", Map.of("email", EMAIL, "password", "wrong")).error());
        Assertions.assertEquals("Incorrect email or password",
                accounts.login(null, "v1", Map.of("email", "nobody@example.com", "password", PASSWORD)).error());
        Assertions.assertEquals("email/password required",
                accounts.login(null, "v1", Map.of("email", EMAIL)).error());
    }

    @Test
    public void issuedTokenResolvesToTheUser() {
        register();
        String token = login();

        Principal bare = authenticator.resolve(token);
        Principal bearer = authenticator.resolve("Bearer " + token);

        Assertions.assertEquals(EMAIL, bare.name());
        Assertions.assertEquals(bare, bearer);
    }

    @Test
    public void garbageTokenIsInvalid() {
        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> authenticator.resolve("not-a-jwt"));

        Assertions.assertEquals("Invalid token", e.getMessage());
    }

    @Test
    public void tokenWithoutSubjectIsRejected() {
        String token = Jwts.builder()
                .issuedAt(Date.from(TasksTestApplication.NOW))
                .signWith(Keys.hmacShaKeyFor(securityProperties.getSecretKey().getBytes(StandardCharsets.UTF_8)))
                .compact();

        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> authenticator.resolve(token));

        Assertions.assertEquals("Invalid token payload (no sub)", e.getMessage());
    }

    @Test
    public void tokenForUnknownUserIsRejected() {
        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> authenticator.resolve(tokens.issue(987_654L)));

        Assertions.assertEquals("User not found", e.getMessage());
    }

    @Test
    public void expiredTokenIsInvalid() {
        register();
        long userId = users.findByEmail(EMAIL).orElseThrow().getId();
        Clock issuedEarlier = Clock.fixed(
                TasksTestApplication.NOW.minus(securityProperties.getAccessTokenTtl()).minus(Duration.ofMinutes(1)),
                ZoneOffset.UTC);
        String expired = new TokenService(securityProperties, issuedEarlier).issue(userId);

        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> authenticator.resolve(expired));

        Assertions.assertEquals("Invalid token", e.getMessage());
    }
}
