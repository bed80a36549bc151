package com.sdclogin.auth.controller;

import com.sdclogin.auth.dto.LoginRequest;
import com.sdclogin.auth.dto.LoginResponse;
import com.sdclogin.auth.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * AuthController - REST endpoint for credential login.
 *
 * Endpoints:
 * - POST /login - Verify email/password and issue a session token
 *
 * Security Model:
 * - Stateless: the returned token is the session, nothing is stored server-side
 * - The client sends the token back in a "token" header on profile requests
 *
 * Error Handling (see GlobalExceptionHandler):
 * - 401 Unauthorized: missing fields, unknown email or wrong password (same body shape)
 * - 400 Bad Request: body is not a JSON object
 *
 * @see AuthService#login for business logic
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Authenticate a user and issue a token.
     *
     * The body is optional at the binding level so that an empty request reaches the
     * service and is reported as missing fields rather than as a framework error.
     *
     * @param request JSON body with email and password
     * @return LoginResponse containing the signed token
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody(required = false) LoginRequest request) {
        String token = authService.login(request);
        return ResponseEntity.ok(new LoginResponse(token));
    }
}
