package com.sdclogin.auth.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way salted password hashing.
 *
 * Hashes are produced by the configured {@link PasswordEncoder} (BCrypt), whose output is
 * self-describing: "$2a$10$" followed by the 22-character salt and the digest. Verification
 * needs nothing but the stored string. BCrypt compares digests without early exit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    /**
     * Hash a plaintext password with a fresh random salt.
     *
     * @param plaintext the password to hash
     * @return encoded hash, different on every call for the same input
     * @throws IllegalArgumentException if plaintext is null
     */
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Check a plaintext password against a stored hash.
     *
     * A null stored hash means no password has been set, so authentication is impossible.
     * Never throws; an unreadable hash counts as a mismatch.
     *
     * @param plaintext  candidate password from the caller
     * @param storedHash hash from the credential store, may be null
     * @return true only when the password matches the hash
     */
    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, storedHash);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored password hash could not be checked: {}", ex.getMessage());
            return false;
        }
    }
}
