package com.sdclogin.auth.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every way a request can fail, with the status and cause text the caller sees.
 *
 * An unknown email and a wrong password both map to ACCESS_DENIED.
 */
@Getter
@RequiredArgsConstructor
public enum AuthErrorType {

    MISSING_FIELDS(HttpStatus.UNAUTHORIZED,
            "Please provide a Json message with 'email' and 'password' fields."),
    ACCESS_DENIED(HttpStatus.UNAUTHORIZED, "Access denied"),
    MISSING_OR_INVALID_TOKEN(HttpStatus.UNAUTHORIZED,
            "Please provide a token header that includes a user_id."),
    SUBJECT_NOT_FOUND(HttpStatus.BAD_REQUEST, "Respondent ID %s not found."),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String messageTemplate;

    public String format(Object... args) {
        return args.length == 0 ? messageTemplate : String.format(messageTemplate, args);
    }
}
