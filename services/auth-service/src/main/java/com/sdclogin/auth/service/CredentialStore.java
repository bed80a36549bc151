package com.sdclogin.auth.service;

import com.sdclogin.auth.entity.User;
import com.sdclogin.auth.repository.UserRepository;
import com.sdclogin.auth.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Sole owner of user records.
 * <p>
 * Lookups are exact matches on the stored email or user_id. A name update is a
 * read-modify-write inside one transaction, flushed before returning; concurrent updates
 * to the same row are serialised by the database and the last writer wins.
 * Provisioning is idempotent on user_id and exists for fixtures and admin tooling.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<User> findByUserId(String userId) {
        return userRepository.findByUserId(userId);
    }

    @Transactional
    public Optional<User> updateName(String userId, String newName) {
        return userRepository.findByUserId(userId)
                .map(user -> {
                    user.setName(newName);
                    return userRepository.saveAndFlush(user);
                });
    }

    /**
     * Create an account without a password unless one with the same user_id already exists.
     *
     * @return the existing or newly created record
     */
    @Transactional
    public User provision(String userId, String name, String email) {
        return userRepository.findByUserId(userId)
                .orElseGet(() -> {
                    log.info("Provisioning user {}", userId);
                    return userRepository.save(User.builder()
                            .userId(userId)
                            .name(name)
                            .email(email)
                            .build());
                });
    }

    /**
     * Hash and store a password for an existing account.
     *
     * @return the updated record, or empty if no such user_id exists
     */
    @Transactional
    public Optional<User> setPassword(String userId, String plaintext) {
        return userRepository.findByUserId(userId)
                .map(user -> {
                    user.setPasswordHash(passwordHasher.hash(plaintext));
                    return userRepository.save(user);
                });
    }
}
