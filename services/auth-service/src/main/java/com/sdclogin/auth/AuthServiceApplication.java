package com.sdclogin.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Main entry point for the login service.
 *
 * This service is responsible for:
 * - Verifying email/password credentials against stored BCrypt hashes
 * - Issuing signed, self-contained session tokens (HMAC-SHA256 JWS)
 * - Resolving a presented token to its subject for profile read/update
 *
 * Architecture Context:
 * - Runs on port 5003 unless PORT is set (configured in application.yml)
 * - Persists users through JPA; the schema is owned by Flyway migrations
 * - Stateless design - no server-side session table, the token is the session
 *
 * @see com.sdclogin.auth.controller.AuthController for the login endpoint
 * @see com.sdclogin.auth.controller.ProfileController for profile endpoints
 * @see com.sdclogin.auth.service.AuthService for business logic
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
