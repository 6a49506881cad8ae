package com.intteq.broker.rpc.tasks;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Credentials for the task service: password hashing, token issuance and the
 * {@link com.intteq.broker.rpc.dispatch.Authenticator} used by the dispatcher.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(SecurityProperties.class)
public class TaskServiceConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public TokenService tokenService(SecurityProperties properties, Clock clock) {
        return new TokenService(properties, clock);
    }

    @Bean
    public JwtAuthenticator jwtAuthenticator(TokenService tokenService, UserRepository users) {
        return new JwtAuthenticator(tokenService, users);
    }
}
