package com.sdclogin.auth.exception;

import lombok.Getter;

/**
 * Terminal failure of an auth operation, tagged with its {@link AuthErrorType}.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorType errorType;

    public AuthException(AuthErrorType errorType, Object... args) {
        super(errorType.format(args));
        this.errorType = errorType;
    }

    public static AuthException subjectNotFound(String userId) {
        return new AuthException(AuthErrorType.SUBJECT_NOT_FOUND, userId);
    }
}
