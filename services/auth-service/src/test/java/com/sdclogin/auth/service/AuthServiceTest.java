package com.sdclogin.auth.service;

import com.sdclogin.auth.config.AuthProperties;
import com.sdclogin.auth.dto.LoginRequest;
import com.sdclogin.auth.dto.ProfileResponse;
import com.sdclogin.auth.dto.ProfileUpdateRequest;
import com.sdclogin.auth.entity.User;
import com.sdclogin.auth.exception.AuthErrorType;
import com.sdclogin.auth.exception.AuthException;
import com.sdclogin.auth.security.PasswordHasher;
import com.sdclogin.auth.security.TokenClaims;
import com.sdclogin.auth.security.TokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String EMAIL = "nick.gravgaard@example.com";

    @Mock
    private CredentialStore credentialStore;

    private PasswordHasher passwordHasher;
    private TokenCodec tokenCodec;
    private AuthService authService;
    private User nick;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        properties.getToken().setSecret("service-test-secret-0123456789-abcdefghij");
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
        tokenCodec = new TokenCodec(properties, Clock.systemUTC());
        authService = new AuthService(credentialStore, passwordHasher, tokenCodec);
        nick = User.builder()
                .id(1L)
                .userId("101")
                .name("Nick Gravgaard")
                .email(EMAIL)
                .passwordHash(passwordHasher.hash("password"))
                .build();
    }

    @Test
    void loginIssuesTokenForCorrectPassword() {
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(nick));

        String token = authService.login(EMAIL, "password");

        assertThat(tokenCodec.decode(token))
                .contains(new TokenClaims("101", "Nick Gravgaard", EMAIL));
    }

    @Test
    void loginWithMissingFieldNeverTouchesTheStore() {
        LoginRequest emailOnly = new LoginRequest();
        emailOnly.setEmail(EMAIL);
        LoginRequest passwordOnly = new LoginRequest();
        passwordOnly.setPassword("password");

        assertError(() -> authService.login((LoginRequest) null), AuthErrorType.MISSING_FIELDS);
        assertError(() -> authService.login(new LoginRequest()), AuthErrorType.MISSING_FIELDS);
        assertError(() -> authService.login(emailOnly), AuthErrorType.MISSING_FIELDS);
        assertError(() -> authService.login(passwordOnly), AuthErrorType.MISSING_FIELDS);

        verify(credentialStore, never()).findByEmail(any());
    }

    @Test
    void explicitNullCredentialIsDeniedNotMissing() {
        assertError(() -> authService.login(new LoginRequest(null, "password")), AuthErrorType.ACCESS_DENIED);
        assertError(() -> authService.login(new LoginRequest(EMAIL, null)), AuthErrorType.ACCESS_DENIED);
    }

    @Test
    void loginRequestWithBothFieldsIssuesToken() {
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(nick));

        assertThat(authService.login(new LoginRequest(EMAIL, "password"))).isNotBlank();
    }

    @Test
    void unknownEmailAndWrongPasswordAreIndistinguishable() {
        when(credentialStore.findByEmail("unknown@example.com")).thenReturn(Optional.empty());
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(nick));

        AuthException unknown = catchAuth(() -> authService.login("unknown@example.com", "x"));
        AuthException wrong = catchAuth(() -> authService.login(EMAIL, "not-the-password"));

        assertThat(unknown.getErrorType()).isEqualTo(AuthErrorType.ACCESS_DENIED);
        assertThat(wrong.getErrorType()).isEqualTo(AuthErrorType.ACCESS_DENIED);
        assertThat(unknown.getMessage()).isEqualTo(wrong.getMessage());
    }

    @Test
    void accountWithoutPasswordCannotLogIn() {
        nick.setPasswordHash(null);
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(nick));

        assertError(() -> authService.login(EMAIL, "password"), AuthErrorType.ACCESS_DENIED);
    }

    @Test
    void getProfileReturnsPublicProjection() {
        when(credentialStore.findByUserId("101")).thenReturn(Optional.of(nick));
        String token = tokenCodec.encode(TokenClaims.of(nick));

        ProfileResponse profile = authService.getProfile(token);

        assertThat(profile).isEqualTo(new ProfileResponse("101", "Nick Gravgaard", EMAIL));
        assertThat(authService.getProfile(token)).isEqualTo(profile);
    }

    @Test
    void getProfileRejectsAbsentOrForgedToken() {
        assertError(() -> authService.getProfile(null), AuthErrorType.MISSING_OR_INVALID_TOKEN);
        assertError(() -> authService.getProfile("forged.token.value"), AuthErrorType.MISSING_OR_INVALID_TOKEN);

        verify(credentialStore, never()).findByUserId(anyString());
    }

    @Test
    void getProfileRejectsTokenWithoutUserId() {
        String token = tokenCodec.encode(new TokenClaims(null, "Nick Gravgaard", EMAIL));

        assertError(() -> authService.getProfile(token), AuthErrorType.MISSING_OR_INVALID_TOKEN);
    }

    @Test
    void getProfileReportsVanishedSubject() {
        when(credentialStore.findByUserId("999")).thenReturn(Optional.empty());
        String token = tokenCodec.encode(new TokenClaims("999", "Ghost", "ghost@example.com"));

        assertThatThrownBy(() -> authService.getProfile(token))
                .isInstanceOf(AuthException.class)
                .hasMessage("Respondent ID 999 not found.");
    }

    @Test
    void updateProfileAppliesName() {
        User renamed = User.builder().userId("101").name("Nick G.").email(EMAIL).build();
        when(credentialStore.findByUserId("101")).thenReturn(Optional.of(nick));
        when(credentialStore.updateName("101", "Nick G.")).thenReturn(Optional.of(renamed));

        ProfileResponse profile = authService.updateProfile(
                tokenCodec.encode(TokenClaims.of(nick)), new ProfileUpdateRequest("Nick G."));

        assertThat(profile.getName()).isEqualTo("Nick G.");
        assertThat(profile.getEmail()).isEqualTo(EMAIL);
    }

    @Test
    void updateProfileWithoutNameChangesNothing() {
        when(credentialStore.findByUserId("101")).thenReturn(Optional.of(nick));
        String token = tokenCodec.encode(TokenClaims.of(nick));

        assertThat(authService.updateProfile(token, null).getName()).isEqualTo("Nick Gravgaard");
        assertThat(authService.updateProfile(token, new ProfileUpdateRequest()).getName()).isEqualTo("Nick Gravgaard");

        verify(credentialStore, never()).updateName(anyString(), any());
    }

    @Test
    void updateProfileRejectsInvalidTokenBeforeAnyWrite() {
        assertError(() -> authService.updateProfile("", new ProfileUpdateRequest("Mallory")),
                AuthErrorType.MISSING_OR_INVALID_TOKEN);

        verify(credentialStore, never()).updateName(anyString(), any());
    }

    @Test
    void updateProfileReportsSubjectRemovedMidRequest() {
        when(credentialStore.findByUserId("101")).thenReturn(Optional.of(nick));
        when(credentialStore.updateName("101", "Nick G.")).thenReturn(Optional.empty());

        assertError(() -> authService.updateProfile(tokenCodec.encode(TokenClaims.of(nick)), new ProfileUpdateRequest("Nick G.")),
                AuthErrorType.SUBJECT_NOT_FOUND);
    }

    private static void assertError(Runnable call, AuthErrorType expected) {
        assertThat(catchAuth(call).getErrorType()).isEqualTo(expected);
    }

    private static AuthException catchAuth(Runnable call) {
        try {
            call.run();
        } catch (AuthException ex) {
            return ex;
        }
        throw new AssertionError("Expected AuthException");
    }
}
