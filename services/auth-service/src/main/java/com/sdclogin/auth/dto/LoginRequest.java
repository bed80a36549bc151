package com.sdclogin.auth.dto;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * LoginRequest - Data Transfer Object for email/password login requests.
 *
 * Usage:
 * <pre>
 * POST /login
 * Content-Type: application/json
 *
 * {
 *   "email": "nick.gravgaard@example.com",
 *   "password": "password"
 * }
 * </pre>
 *
 * Both fields are required. Absence is checked by the service rather than by bean
 * validation, because a missing field must produce the same 401 as any other failed
 * login attempt. A field that is present counts as supplied even when its value is
 * JSON null or an empty string; such a value is simply a wrong credential.
 *
 * Security Note:
 * The password is excluded from toString() and must never be logged or persisted.
 *
 * @see com.sdclogin.auth.controller.AuthController for endpoint handling
 */
@Data
@NoArgsConstructor
public class LoginRequest {

    private String email;

    @ToString.Exclude
    private String password;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean emailSupplied;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean passwordSupplied;

    public LoginRequest(String email, String password) {
        setEmail(email);
        setPassword(password);
    }

    public void setEmail(String email) {
        this.email = email;
        this.emailSupplied = true;
    }

    public void setPassword(String password) {
        this.password = password;
        this.passwordSupplied = true;
    }

    /**
     * @return true if the body named both fields, whatever their values
     */
    public boolean hasBothFields() {
        return emailSupplied && passwordSupplied;
    }
}
