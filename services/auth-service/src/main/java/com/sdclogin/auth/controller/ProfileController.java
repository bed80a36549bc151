package com.sdclogin.auth.controller;

import com.sdclogin.auth.dto.ProfileResponse;
import com.sdclogin.auth.dto.ProfileUpdateRequest;
import com.sdclogin.auth.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * ProfileController - read and update the profile of the token's subject.
 *
 * Endpoints:
 * - GET  /profile - Return {user_id, name, email} for the token subject
 * - POST /profile - Apply {"name": ...} if present, then return the updated profile
 *
 * The token travels in a plain "token" header, not as an Authorization bearer.
 * A caller can only ever reach its own profile; there is no user_id parameter.
 *
 * Error Handling (see GlobalExceptionHandler):
 * - 401 Unauthorized: token header absent, malformed, forged or without a user_id
 * - 400 Bad Request: token subject no longer exists, or name longer than 255 characters
 */
@RestController
@RequestMapping("/profile")
@RequiredArgsConstructor
public class ProfileController {

    static final String TOKEN_HEADER = "token";

    private final AuthService authService;

    @GetMapping
    public ResponseEntity<ProfileResponse> getProfile(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(authService.getProfile(token));
    }

    @PostMapping
    public ResponseEntity<ProfileResponse> updateProfile(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody(required = false) ProfileUpdateRequest patch) {
        return ResponseEntity.ok(authService.updateProfile(token, patch));
    }
}
