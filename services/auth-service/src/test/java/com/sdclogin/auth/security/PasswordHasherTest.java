package com.sdclogin.auth.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    void hashVerifiesAgainstItsPlaintext() {
        String hash = hasher.hash("password");

        assertThat(hash).isNotEqualTo("password");
        assertThat(hasher.verify("password", hash)).isTrue();
        assertThat(hasher.verify("Password", hash)).isFalse();
    }

    @Test
    void hashIsSaltedAndSelfDescribing() {
        String first = hasher.hash("password");
        String second = hasher.hash("password");

        assertThat(first).isNotEqualTo(second);
        assertThat(first).startsWith("$2a$04$");
        assertThat(hasher.verify("password", second)).isTrue();
    }

    @Test
    void nullStoredHashNeverVerifies() {
        assertThat(hasher.verify("password", null)).isFalse();
        assertThat(hasher.verify("", null)).isFalse();
        assertThat(hasher.verify(null, null)).isFalse();
    }

    @Test
    void nullPlaintextNeverVerifies() {
        assertThat(hasher.verify(null, hasher.hash("password"))).isFalse();
    }

    @Test
    void unreadableStoredHashIsAMismatch() {
        assertThat(hasher.verify("password", "password")).isFalse();
        assertThat(hasher.verify("password", "")).isFalse();
    }

    @Test
    void nullPlaintextCannotBeHashed() {
        assertThatThrownBy(() -> hasher.hash(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
