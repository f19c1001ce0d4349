package com.saddlery.auth.service;

import com.saddlery.auth.api.dto.*;
import com.saddlery.auth.audit.AuditAction;
import com.saddlery.auth.audit.AuditEvent;
import com.saddlery.auth.audit.AuditSink;
import com.saddlery.auth.config.AuthProperties;
import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.auth.mail.MailNotifier;
import com.saddlery.auth.model.ClientInfo;
import com.saddlery.auth.token.PurposeTokenService;
import com.saddlery.auth.token.SignedToken;
import com.saddlery.auth.token.TokenIssuer;
import com.saddlery.auth.token.TokenPair;
import com.saddlery.role.domain.Role;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ClientInfo CLIENT = new ClientInfo("203.0.113.7", "JUnit");
    private static final Role FITTER = new Role(3, "fitter");

    @Mock
    private UserService userService;
    @Mock
    private RoleResolver roleResolver;
    @Mock
    private TokenIssuer tokenIssuer;
    @Mock
    private PurposeTokenService purposeTokenService;
    @Mock
    private AuditSink auditSink;
    @Mock
    private MailNotifier mailNotifier;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private AuthService authService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AuthProperties properties = new AuthProperties();
        LockoutGuard lockoutGuard = new LockoutGuard(userService, properties);
        CredentialVerifier verifier = new CredentialVerifier(userService, lockoutGuard, passwordEncoder, clock);
        authService = new AuthService(verifier, lockoutGuard, roleResolver, tokenIssuer, purposeTokenService,
                userService, auditSink, mailNotifier, passwordEncoder, properties, clock);
    }

    private User adam() {
        return User.builder()
                .id(1L)
                .username("adamwhitehouse")
                .email("adam@example.com")
                .passwordHash(passwordEncoder.encode("welcomeAdam!@"))
                .enabled(true)
                .provider("email")
                .userType(1)
                .failedLoginAttempts(0)
                .build();
    }

    private AuditEvent capturedAudit() {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).record(captor.capture());
        return captor.getValue();
    }

    @Test
    void login_fitterWithCorrectPassword_getsSessionTokensAndRole() {
        User user = adam();
        TokenPair pair = new TokenPair("access", NOW.plus(Duration.ofMinutes(15)), "refresh", NOW.plus(Duration.ofDays(30)), 11L);
        when(userService.findByEmailOrUsername("adamwhitehouse")).thenReturn(Optional.of(user));
        when(roleResolver.resolve(user)).thenReturn(FITTER);
        when(tokenIssuer.startSession(user, FITTER)).thenReturn(pair);

        LoginResponse response = authService.login(new LoginRequest("adamwhitehouse", "welcomeAdam!@"), CLIENT);

        assertThat(response.token()).isEqualTo("access");
        assertThat(response.refreshToken()).isEqualTo("refresh");
        assertThat(response.tokenExpires()).isEqualTo(NOW.plus(Duration.ofMinutes(15)).toEpochMilli());
        assertThat(response.user().typeName()).isEqualTo("fitter");
        assertThat(response.user().role()).isEqualTo(FITTER);
        verify(userService).registerSuccessfulLogin(1L, NOW);

        AuditEvent event = capturedAudit();
        assertThat(event.getAction()).isEqualTo(AuditAction.LOGIN);
        assertThat(event.isSuccess()).isTrue();
        assertThat(event.getUserId()).isEqualTo(1L);
        assertThat(event.getSessionId()).isEqualTo(11L);
        assertThat(event.getIp()).isEqualTo("203.0.113.7");
    }

    @Test
    void login_wrongPassword_countsFailureAndAudits() {
        User user = adam();
        when(userService.findByEmailOrUsername("adamwhitehouse")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login(new LoginRequest("adamwhitehouse", "nope"), CLIENT))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INCORRECT_PASSWORD);

        verify(userService).registerFailedLogin(1L, 5, NOW.plus(Duration.ofMinutes(15)));
        verify(tokenIssuer, never()).startSession(any(), any());
        AuditEvent event = capturedAudit();
        assertThat(event.isSuccess()).isFalse();
        assertThat(event.getFailureReason()).isEqualTo("incorrectPassword");
    }

    @Test
    void login_unknownIdentifier_auditsWithoutActor() {
        when(userService.findByEmailOrUsername("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest("ghost@example.com", "x"), CLIENT))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.IDENTIFIER_NOT_FOUND);

        AuditEvent event = capturedAudit();
        assertThat(event.getUserId()).isNull();
        assertThat(event.getIdentifier()).isEqualTo("ghost@example.com");
        assertThat(event.getFailureReason()).isEqualTo("notFound");
        verify(userService, never()).registerFailedLogin(anyLong(), anyInt(), any());
    }

    @Test
    void login_lockedAccount_doesNotCountAnotherFailure() {
        User user = adam();
        user.setLockedUntil(NOW.plus(Duration.ofMinutes(5)));
        when(userService.findByEmailOrUsername("adamwhitehouse")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login(new LoginRequest("adamwhitehouse", "welcomeAdam!@"), CLIENT))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ACCOUNT_LOCKED);

        verify(userService, never()).registerFailedLogin(anyLong(), anyInt(), any());
        assertThat(capturedAudit().getFailureReason()).isEqualTo("locked");
    }

    @Test
    void register_createsDisabledEmailAccountAndMailsConfirmation() {
        when(userService.existsByEmail("new@example.com")).thenReturn(false);
        when(userService.createUser(any(User.class))).thenAnswer(invocation -> {
            User created = invocation.getArgument(0);
            created.setId(42L);
            return created;
        });
        when(purposeTokenService.issueEmailConfirmation(42L))
                .thenReturn(new SignedToken("confirm-hash", NOW, NOW.plus(Duration.ofDays(1))));

        authService.register(new RegisterRequest(" New@Example.com ", "secret1", null, "New User"));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userService).createUser(captor.capture());
        User created = captor.getValue();
        assertThat(created.getEmail()).isEqualTo("new@example.com");
        assertThat(created.getUsername()).isEqualTo("new@example.com");
        assertThat(created.getEnabled()).isFalse();
        assertThat(created.getProvider()).isEqualTo("email");
        assertThat(passwordEncoder.matches("secret1", created.getPasswordHash())).isTrue();
        verify(mailNotifier).sendConfirmEmail("new@example.com", "confirm-hash");
    }

    @Test
    void register_existingEmail_isRejected() {
        when(userService.existsByEmail("adam@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(new RegisterRequest("adam@example.com", "secret1", null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.EMAIL_EXISTS);
        verify(userService, never()).createUser(any());
    }

    @Test
    void register_usernameTakenByAnotherAccount_isRejected() {
        when(userService.existsByEmail("new@example.com")).thenReturn(false);
        when(userService.existsByUsername("adamwhitehouse")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("new@example.com", "secret1", " adamwhitehouse ", null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.USERNAME_EXISTS);
        verify(userService, never()).createUser(any());
    }

    @Test
    void register_shortPasswordOrBadEmail_isRejected() {
        assertThatThrownBy(() -> authService.register(new RegisterRequest("a@example.com", "12345", null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PASSWORD_POLICY_VIOLATION);
        assertThatThrownBy(() -> authService.register(new RegisterRequest("not-an-email", "secret1", null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_EMAIL);
    }

    @Test
    void forgotPassword_mailsResetTokenWithExpiry() {
        when(userService.findByEmail("adam@example.com")).thenReturn(Optional.of(adam()));
        Instant expires = NOW.plus(Duration.ofMinutes(30));
        when(purposeTokenService.issuePasswordReset(1L)).thenReturn(new SignedToken("reset-hash", NOW, expires));

        authService.forgotPassword("Adam@Example.com");

        verify(mailNotifier).sendForgotPassword("adam@example.com", "reset-hash", expires);
    }

    @Test
    void forgotPassword_unknownEmail_isRejected() {
        when(userService.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.forgotPassword("ghost@example.com"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("emailNotExists");
    }

    @Test
    void resetPassword_checksPolicyBeforeTouchingToken() {
        assertThatThrownBy(() -> authService.resetPassword(new PasswordResetRequest("hash", "   ")))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PASSWORD_POLICY_VIOLATION);
        verify(purposeTokenService, never()).resetPassword(anyString(), anyString());
    }

    @Test
    void logout_deletesSessionAndAudits() {
        authService.logout(1L, 11L, CLIENT);

        verify(tokenIssuer).logout(11L);
        AuditEvent event = capturedAudit();
        assertThat(event.getAction()).isEqualTo(AuditAction.LOGOUT);
        assertThat(event.getSessionId()).isEqualTo(11L);
    }

    @Test
    void refresh_returnsRotatedPairWithExpiryInEpochMillis() {
        Instant accessExpiry = NOW.plus(Duration.ofMinutes(15));
        when(tokenIssuer.refresh("old-refresh"))
                .thenReturn(new TokenPair("access-2", accessExpiry, "refresh-2", NOW.plus(Duration.ofDays(30)), 11L));

        TokenResponse response = authService.refresh(new TokenRefreshRequest("old-refresh"));

        assertThat(response.token()).isEqualTo("access-2");
        assertThat(response.refreshToken()).isEqualTo("refresh-2");
        assertThat(response.tokenExpires()).isEqualTo(1772359200000L + Duration.ofMinutes(15).toMillis());
    }

    @Test
    void me_missingAccount_isUserNotFound() {
        when(userService.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.me(1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.USER_NOT_FOUND);
    }

    @Test
    void update_passwordWithoutOldPassword_isRejected() {
        when(userService.findById(1L)).thenReturn(Optional.of(adam()));

        assertThatThrownBy(() -> authService.update(1L, 11L, new AuthUpdateRequest(null, null, "newSecret1", null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.MISSING_OLD_PASSWORD);
    }

    @Test
    void update_wrongOldPassword_isRejected() {
        when(userService.findById(1L)).thenReturn(Optional.of(adam()));

        assertThatThrownBy(() -> authService.update(1L, 11L, new AuthUpdateRequest(null, null, "newSecret1", "wrong")))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INCORRECT_OLD_PASSWORD);
        verify(userService, never()).updatePassword(anyLong(), anyString());
    }

    @Test
    void update_passwordChange_revokesOtherSessions() {
        User user = adam();
        when(userService.findById(1L)).thenReturn(Optional.of(user));
        when(roleResolver.resolve(user)).thenReturn(FITTER);

        AuthUserResponse response = authService.update(1L, 11L,
                new AuthUpdateRequest(null, null, "newSecret1", "welcomeAdam!@"));

        verify(userService).updatePassword(eq(1L), anyString());
        verify(tokenIssuer).revokeAllExcept(1L, 11L);
        assertThat(response.typeName()).isEqualTo("fitter");
    }

    @Test
    void update_emailTakenByAnotherAccount_isRejected() {
        when(userService.findById(1L)).thenReturn(Optional.of(adam()));
        User other = User.builder().id(2L).email("taken@example.com").build();
        when(userService.findByEmail("taken@example.com")).thenReturn(Optional.of(other));

        assertThatThrownBy(() -> authService.update(1L, 11L, new AuthUpdateRequest(null, "taken@example.com", null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.EMAIL_EXISTS);
        verify(mailNotifier, never()).sendConfirmNewEmail(anyString(), anyString());
    }

    @Test
    void update_newEmail_isOnlyMailedNotWritten() {
        User user = adam();
        when(userService.findById(1L)).thenReturn(Optional.of(user));
        when(userService.findByEmail("fresh@example.com")).thenReturn(Optional.empty());
        when(purposeTokenService.issueNewEmailConfirmation(1L, "fresh@example.com"))
                .thenReturn(new SignedToken("new-email-hash", NOW, NOW.plus(Duration.ofDays(1))));
        when(roleResolver.resolve(user)).thenReturn(FITTER);

        AuthUserResponse response = authService.update(1L, 11L, new AuthUpdateRequest("Adam W", "fresh@example.com", null, null));

        verify(mailNotifier).sendConfirmNewEmail("fresh@example.com", "new-email-hash");
        verify(userService).updateName(1L, "Adam W");
        verify(userService, never()).updateEmailAndEnable(anyLong(), anyString());
        assertThat(response.email()).isEqualTo("adam@example.com");
    }
}
