package com.sdclogin.auth.service;

import com.sdclogin.auth.dto.LoginRequest;
import com.sdclogin.auth.dto.ProfileResponse;
import com.sdclogin.auth.dto.ProfileUpdateRequest;
import com.sdclogin.auth.entity.User;
import com.sdclogin.auth.exception.AuthErrorType;
import com.sdclogin.auth.exception.AuthException;
import com.sdclogin.auth.security.PasswordHasher;
import com.sdclogin.auth.security.TokenClaims;
import com.sdclogin.auth.security.TokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * AuthService - Core business logic for login and token-authorised profile access.
 *
 * Each request moves through the same stateless sequence:
 * UNAUTHENTICATED -> VERIFIED (credentials checked) -> SESSION_ACTIVE (token issued)
 * -> AUTHORIZED_FOR_SUBJECT or REJECTED (token presented on a later request).
 * Nothing is kept between requests; the token is the whole session.
 *
 * Failures are thrown as {@link AuthException} tagged with an {@link AuthErrorType}
 * and are terminal for the request. Nothing is retried.
 *
 * Security Considerations:
 * - Unknown email and wrong password are reported identically (no user enumeration)
 * - A valid token whose subject has since disappeared is reported separately as
 *   SUBJECT_NOT_FOUND, since the token itself was genuine
 * - Only the name field of a profile can be changed
 *
 * @see TokenCodec for token operations
 * @see CredentialStore for user records
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final TokenCodec tokenCodec;

    /**
     * Verify the credentials in a login body and issue a session token.
     *
     * @param request parsed body, or null if the request had none
     * @return signed token embedding the user's public projection
     * @throws AuthException MISSING_FIELDS if the body does not name both email and password,
     *                       otherwise as {@link #login(String, String)}
     */
    public String login(LoginRequest request) {
        if (request == null || !request.hasBothFields()) {
            throw new AuthException(AuthErrorType.MISSING_FIELDS);
        }
        return login(request.getEmail(), request.getPassword());
    }

    /**
     * Verify an email/password pair and issue a session token.
     *
     * @param email    login identifier, matched exactly
     * @param password plaintext candidate password
     * @return signed token embedding the user's public projection
     * @throws AuthException ACCESS_DENIED if either value is null, the email is unknown,
     *                       the account has no password, or the password does not match
     */
    public String login(String email, String password) {
        if (email == null || password == null) {
            throw new AuthException(AuthErrorType.ACCESS_DENIED);
        }

        User user = credentialStore.findByEmail(email)
                .filter(candidate -> passwordHasher.verify(password, candidate.getPasswordHash()))
                .orElseThrow(() -> new AuthException(AuthErrorType.ACCESS_DENIED));

        String token = tokenCodec.encode(TokenClaims.of(user));
        log.info("User authenticated successfully: {}", user.getUserId());
        return token;
    }

    /**
     * Resolve a token to the profile of its subject.
     *
     * @param token raw value of the token header, may be null
     * @return public projection of the subject
     * @throws AuthException MISSING_OR_INVALID_TOKEN or SUBJECT_NOT_FOUND
     */
    public ProfileResponse getProfile(String token) {
        return ProfileResponse.from(resolveSubject(token));
    }

    /**
     * Apply an allow-listed patch to the token subject's profile.
     *
     * @param token raw value of the token header, may be null
     * @param patch requested changes; null or a null name changes nothing
     * @return public projection after the change has been committed
     * @throws AuthException MISSING_OR_INVALID_TOKEN or SUBJECT_NOT_FOUND
     */
    public ProfileResponse updateProfile(String token, ProfileUpdateRequest patch) {
        User user = resolveSubject(token);
        if (patch == null || patch.getName() == null) {
            return ProfileResponse.from(user);
        }

        // Subject may be removed between the lookup and the update
        User updated = credentialStore.updateName(user.getUserId(), patch.getName())
                .orElseThrow(() -> AuthException.subjectNotFound(user.getUserId()));
        log.info("Updated name for user {}", updated.getUserId());
        return ProfileResponse.from(updated);
    }

    private User resolveSubject(String token) {
        String userId = tokenCodec.decode(token)
                .map(TokenClaims::userId)
                .orElseThrow(() -> new AuthException(AuthErrorType.MISSING_OR_INVALID_TOKEN));

        return credentialStore.findByUserId(userId)
                .orElseThrow(() -> AuthException.subjectNotFound(userId));
    }
}
