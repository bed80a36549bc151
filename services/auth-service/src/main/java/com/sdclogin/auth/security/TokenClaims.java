package com.sdclogin.auth.security;

import com.sdclogin.auth.entity.User;

/**
 * Identity claims carried inside a session token.
 *
 * A closed set: only the public projection of a user is ever signed into a token, so
 * nothing else on the entity can leak through it. Fields decoded from a foreign but
 * validly signed token may be null.
 */
public record TokenClaims(String userId, String name, String email) {

    public static TokenClaims of(User user) {
        return new TokenClaims(user.getUserId(), user.getName(), user.getEmail());
    }
}
