package com.intteq.broker.rpc.tasks;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Token settings.
 *
 * <p>Prefix: {@code rpc.security.*}
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rpc.security")
public class SecurityProperties {

    /** HMAC-SHA256 signing secret. At least 32 bytes. */
    @NotBlank(message = "rpc.security.secret-key must be set")
    @Size(min = 32, message = "rpc.security.secret-key must be at least 32 characters")
    private String secretKey;

    /** Lifetime of issued access tokens. */
    @NotNull
    private Duration accessTokenTtl = Duration.ofMinutes(60);

    @Override
    public String toString() {
        return "SecurityProperties(accessTokenTtl=" + accessTokenTtl + ")";
    }
}
