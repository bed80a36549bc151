package com.sdclogin.auth.exception;

import com.sdclogin.auth.dto.ErrorResponse;
import com.sdclogin.auth.web.RequestPayloadRedactor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Translates every failure into {"message": "&lt;cause&gt;: &lt;request url&gt;"} with status
 * 400, 401, 404, 405 or 500.
 * <p>
 * Client errors are logged at WARN with the redacted request payload. Anything not
 * otherwise classified is {@link AuthErrorType#UNEXPECTED}: logged at ERROR with its stack
 * trace, answered with a generic cause so no internals reach the caller.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    static final String MALFORMED_BODY = "Request body must be a JSON object";

    private final RequestPayloadRedactor payloadRedactor;

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException ex, HttpServletRequest request) {
        HttpStatus status = ex.getErrorType().getStatus();
        if (status.is5xxServerError()) {
            log.error("{} at {}: '{}'", ex.getErrorType(), request.getRequestURI(), payloadRedactor.describe(request), ex);
        } else {
            log.warn("{} at {}: '{}'", ex.getErrorType(), request.getRequestURI(), payloadRedactor.describe(request));
        }
        return respond(status, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String cause = ex.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Validation failed at {}: {}", request.getRequestURI(), cause);
        return respond(HttpStatus.BAD_REQUEST, cause, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableBody(Exception ex, HttpServletRequest request) {
        log.warn("Unreadable body at {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, MALFORMED_BODY, request);
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleRouting(Exception ex, HttpServletRequest request) {
        HttpStatusCode statusCode = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        HttpStatus status = HttpStatus.valueOf(statusCode.value());
        return respond(status, status.getReasonPhrase(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure at {}: '{}'", request.getRequestURI(), payloadRedactor.describe(request), ex);
        AuthErrorType type = AuthErrorType.UNEXPECTED;
        return respond(type.getStatus(), type.format(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String cause, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(cause + ": " + requestUrl(request)));
    }

    private static String requestUrl(HttpServletRequest request) {
        StringBuffer url = request.getRequestURL();
        String query = request.getQueryString();
        return query == null ? url.toString() : url.append('?').append(query).toString();
    }
}
