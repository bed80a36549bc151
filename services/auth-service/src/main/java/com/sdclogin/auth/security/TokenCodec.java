package com.sdclogin.auth.security;

import com.sdclogin.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * TokenCodec - Encodes identity claims into signed session tokens and back.
 *
 * JWT Structure (RFC 7519):
 * - Header: {"alg":"HS256"}
 * - Payload: user_id, name, email (plus iat/exp when a TTL is configured)
 * - Signature: HMAC-SHA256 over header and payload using the process-wide secret
 *
 * Decoding rejects, as {@link Optional#empty()} rather than an exception:
 * - blank or absent input
 * - malformed or unsigned ("alg":"none") tokens
 * - signature mismatch, i.e. any change to header or payload
 * - a signature segment that is not canonical base64url (non-zero trailing bits)
 * - any declared algorithm other than HS256, even one the key could verify
 * - claims of the wrong type
 * - expired tokens, when expiry is in use
 *
 * Token Lifetime:
 * Without auth.token.ttl no exp claim is written and a token stays valid until the
 * secret is rotated. There is no revocation.
 *
 * The signing key is derived once here and never leaves this class.
 *
 * @see com.sdclogin.auth.service.AuthService for issuance and validation context
 */
@Slf4j
@Component
public class TokenCodec {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_EMAIL = "email";

    private static final SignatureAlgorithm ALGORITHM = SignatureAlgorithm.HS256;
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey signingKey;
    private final JwtParser parser;
    private final Duration ttl;
    private final Clock clock;

    public TokenCodec(AuthProperties properties, Clock clock) {
        String secret = properties.getToken().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "auth.token.secret must be at least " + MIN_SECRET_BYTES + " bytes for " + ALGORITHM.getValue());
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = properties.getToken().getTtl();
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Sign the given claims into a compact token string (header.payload.signature).
     *
     * @param claims identity to embed
     * @return signed token
     */
    public String encode(TokenClaims claims) {
        JwtBuilder builder = Jwts.builder()
                .claim(CLAIM_USER_ID, claims.userId())
                .claim(CLAIM_NAME, claims.name())
                .claim(CLAIM_EMAIL, claims.email());
        if (ttl != null) {
            Instant issuedAt = clock.instant();
            builder.setIssuedAt(Date.from(issuedAt))
                    .setExpiration(Date.from(issuedAt.plus(ttl)));
        }
        return builder.signWith(signingKey, ALGORITHM).compact();
    }

    /**
     * Verify a token and extract its claims.
     *
     * @param token raw token as presented by the caller, may be null
     * @return the claims, or empty if the token is not one this service issued and still honours
     */
    public Optional<TokenClaims> decode(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jws<Claims> jws = parser.parseClaimsJws(token);
            if (!hasCanonicalSignature(token)) {
                log.debug("Rejected token with non-canonical signature encoding");
                return Optional.empty();
            }
            String algorithm = jws.getHeader().getAlgorithm();
            if (!ALGORITHM.getValue().equals(algorithm)) {
                log.debug("Rejected token signed with unexpected algorithm {}", algorithm);
                return Optional.empty();
            }
            Claims body = jws.getBody();
            return Optional.of(new TokenClaims(
                    body.get(CLAIM_USER_ID, String.class),
                    body.get(CLAIM_NAME, String.class),
                    body.get(CLAIM_EMAIL, String.class)));
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected token: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    // The last base64url character of an HS256 signature carries two unused bits that the decoder ignores.
    private static boolean hasCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        return Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature);
    }
}
