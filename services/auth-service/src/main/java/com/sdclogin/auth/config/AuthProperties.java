package com.sdclogin.auth.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Process-wide settings bound from the {@code auth.*} namespace of application.yml.
 *
 * Built once at startup and injected wherever it is needed; nothing reads these values
 * from static state. The signing secret is excluded from {@link #toString()} so that
 * logging the bound configuration can never leak it.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    @Valid
    private final Token token = new Token();

    @Valid
    private final Password password = new Password();

    @Valid
    private final DemoAccounts demoAccounts = new DemoAccounts();

    @Data
    public static class Token {

        /**
         * HMAC-SHA256 signing secret, at least 32 bytes. Supplied through JWT_SECRET.
         */
        @NotBlank
        @ToString.Exclude
        private String secret;

        /**
         * Validity window embedded as the exp claim. Unset means tokens never expire,
         * which keeps them usable until the secret is rotated.
         */
        private Duration ttl;
    }

    @Data
    public static class Password {

        @Min(4)
        @Max(31)
        private int bcryptStrength = 10;
    }

    @Data
    public static class DemoAccounts {

        private boolean enabled = true;

        @NotNull
        @ToString.Exclude
        private String password = "password";
    }
}
