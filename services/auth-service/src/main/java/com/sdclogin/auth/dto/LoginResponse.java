package com.sdclogin.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginResponse - returned after successful authentication.
 *
 * Example Response:
 * <pre>
 * {
 *   "token": "eyJhbGciOiJIUzI1NiJ9.eyJ1c2VyX2lkIjoiMTAxIiwi...signature"
 * }
 * </pre>
 *
 * The client passes the token back verbatim in a "token" request header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    private String token;
}
