package com.sdclogin.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * User - JPA Entity representing a login account.
 *
 * This entity maps to the 'users' table created by V1__create_users_table.sql and is
 * the only place credentials live. The auth service holds instances only for the
 * duration of a request.
 *
 * Table Schema:
 * - id: surrogate primary key (identity column, never exposed)
 * - user_id: external-facing short identifier, unique, immutable, carried in tokens
 * - name: display name, the only field a caller may change
 * - email: unique login identifier, matched exactly as stored
 * - password_hash: BCrypt hash, null until a password has been set
 * - created_at / updated_at: maintained by Hibernate
 *
 * Design Decisions:
 * - Surrogate id vs user_id: the database key stays internal; tokens and
 *   responses only ever carry user_id
 * - Nullable password_hash: a provisioned account cannot log in until a
 *   password is set
 * - passwordHash is excluded from toString() so the hash never reaches a log line
 *
 * @see com.sdclogin.auth.repository.UserRepository for database operations
 * @see com.sdclogin.auth.service.CredentialStore for the store contract
 */
@Entity
@Table(name = "users")
@Data  // Lombok: generates getters, setters, equals, hashCode, toString
@NoArgsConstructor  // Lombok: required by JPA for entity instantiation
@AllArgsConstructor  // Lombok: enables builder pattern
@Builder  // Lombok: enables fluent builder API for object construction
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * External identifier, e.g. "101". Embedded in tokens as the user_id claim.
     */
    @Column(name = "user_id", length = 10, unique = true, nullable = false, updatable = false)
    private String userId;

    @Column(name = "name", length = 255)
    private String name;

    /**
     * Login identifier. Unique across all records; lookups are exact, no case folding.
     */
    @Column(name = "email", length = 255, unique = true, nullable = false, updatable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Whether this account can authenticate at all.
     */
    public boolean hasPassword() {
        return passwordHash != null;
    }
}
