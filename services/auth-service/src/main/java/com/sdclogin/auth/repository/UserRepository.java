package com.sdclogin.auth.repository;

import com.sdclogin.auth.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Spring Data JPA generates the implementation at runtime from the method names:
 * - findByEmail -> SELECT * FROM users WHERE email = ?
 * - findByUserId -> SELECT * FROM users WHERE user_id = ?
 *
 * All comparisons are exact on the stored value (no trimming, no case folding).
 * Both email and user_id are backed by unique constraints, so at most one row matches.
 *
 * @see User for entity definition
 * @see com.sdclogin.auth.service.CredentialStore for the transactional contract built on top
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by email address, the lookup used during login.
     *
     * @param email The email address to search for (case-sensitive)
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByEmail(String email);

    /**
     * Find a user by the external identifier carried in a token.
     *
     * @param userId The user_id claim value
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByUserId(String userId);
}
