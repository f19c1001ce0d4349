package com.saddlery.auth.service;

import com.saddlery.auth.api.dto.*;
import com.saddlery.auth.audit.AuditAction;
import com.saddlery.auth.audit.AuditEvent;
import com.saddlery.auth.audit.AuditSink;
import com.saddlery.auth.config.AuthProperties;
import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.auth.mail.MailNotifier;
import com.saddlery.auth.model.AuthProvider;
import com.saddlery.auth.model.ClientInfo;
import com.saddlery.auth.token.PurposeTokenService;
import com.saddlery.auth.token.SignedToken;
import com.saddlery.auth.token.TokenIssuer;
import com.saddlery.auth.token.TokenPair;
import com.saddlery.auth.util.IdentifierValidator;
import com.saddlery.role.domain.Role;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * 认证业务服务。
 * <p>
 * 职责：邮箱登录、注册、确认邮箱、找回/重置密码、刷新令牌、登出、查询与更新当前账号。
 * 安全策略：
 * - 登录依次校验账号、登录渠道、锁定状态与密码，密码错误累加失败计数，达到阈值自动锁定；
 * - 每次登录创建独立会话，刷新令牌随会话 hash 轮换，旧令牌重放即失效；
 * - 重置密码撤销全部会话，修改密码撤销当前会话以外的会话；
 * - 角色每次实时推导，不信任令牌中的旧角色。
 * 审计：登录成功/失败（含未识别账号）与登出，异步写入，失败不影响主流程。
 * 依赖：CredentialVerifier、LockoutGuard、RoleResolver、TokenIssuer、PurposeTokenService、UserService、
 * AuditSink、MailNotifier、PasswordEncoder、AuthProperties。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final CredentialVerifier credentialVerifier;
    private final LockoutGuard lockoutGuard;
    private final RoleResolver roleResolver;
    private final TokenIssuer tokenIssuer;
    private final PurposeTokenService purposeTokenService;
    private final UserService userService;
    private final AuditSink auditSink;
    private final MailNotifier mailNotifier;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * 邮箱/用户名密码登录。
     * <p>
     * 校验通过后重置失败计数、推导角色、创建会话并签发令牌对；密码错误时记录一次失败。
     * 无论成功与否都提交审计事件。
     *
     * @param request    登录请求，包含：标识（邮箱或用户名）与密码。
     * @param clientInfo 客户端信息（IP/UA），用于审计。
     * @return 登录响应，包含令牌对、访问令牌过期时间与账号信息。
     * @throws BusinessException 账号不存在、渠道不符、已锁定或密码错误时抛出。
     */
    public LoginResponse login(LoginRequest request, ClientInfo clientInfo) {
        String identifier = request.identifier() == null ? null : request.identifier().trim();
        User user;
        try {
            user = credentialVerifier.resolveAccount(identifier);
        } catch (BusinessException ex) {
            auditLogin(null, identifier, false, ex.reasonCode(), null, clientInfo);
            throw ex;
        }

        try {
            credentialVerifier.checkCredentials(user, request.password());
        } catch (BusinessException ex) {
            if (ex.getErrorCode() == ErrorCode.INCORRECT_PASSWORD) {
                lockoutGuard.recordFailure(user, Instant.now(clock));
            }
            auditLogin(user.getId(), identifier, false, ex.reasonCode(), null, clientInfo);
            throw ex;
        }

        Instant now = Instant.now(clock);
        lockoutGuard.recordSuccess(user, now);
        user.setFailedLoginAttempts(0);
        user.setLastLogin(now);

        Role role = roleResolver.resolve(user);
        TokenPair tokenPair = tokenIssuer.startSession(user, role);
        auditLogin(user.getId(), identifier, true, null, tokenPair.sessionId(), clientInfo);
        return new LoginResponse(tokenPair.accessToken(), tokenPair.refreshToken(),
                tokenPair.accessTokenExpiresAt().toEpochMilli(), mapUser(user, role));
    }

    /**
     * 邮箱注册。
     * <p>
     * 账号创建后处于未启用状态，确认令牌通过邮件发送；注册本身不签发访问令牌。
     *
     * @param request 注册请求，包含：邮箱、密码、可选用户名与姓名。
     * @throws BusinessException 邮箱格式错误、密码不合规、邮箱或用户名已存在时抛出。
     */
    public void register(RegisterRequest request) {
        if (!IdentifierValidator.isValidEmail(request.email())) {
            throw new BusinessException(ErrorCode.INVALID_EMAIL);
        }
        validatePassword(request.password());
        String email = IdentifierValidator.normalizeEmail(request.email());
        if (userService.existsByEmail(email)) {
            throw new BusinessException(ErrorCode.EMAIL_EXISTS);
        }
        // 用户名同样是登录标识，必须唯一
        String username = StringUtils.hasText(request.username()) ? request.username().trim() : email;
        if (userService.existsByUsername(username)) {
            throw new BusinessException(ErrorCode.USERNAME_EXISTS);
        }

        User user = User.builder()
                .email(email)
                .username(username)
                .name(request.name())
                .passwordHash(passwordEncoder.encode(request.password()))
                .enabled(Boolean.FALSE)
                .failedLoginAttempts(0)
                .provider(AuthProvider.EMAIL.tag())
                .build();
        userService.createUser(user);
        log.info("Account registered userId={}", user.getId());

        SignedToken token = purposeTokenService.issueEmailConfirmation(user.getId());
        mailNotifier.sendConfirmEmail(email, token.value());
    }

    /**
     * 确认注册邮箱。
     *
     * @param hash 邮件中的确认令牌。
     */
    public void confirmEmail(String hash) {
        purposeTokenService.confirmEmail(hash);
    }

    /**
     * 确认新邮箱。
     *
     * @param hash 邮件中的确认令牌。
     */
    public void confirmNewEmail(String hash) {
        purposeTokenService.confirmNewEmail(hash);
    }

    /**
     * 发起找回密码：签发重置令牌并连同过期时间邮件发送。
     *
     * @param email 账号邮箱。
     * @throws BusinessException 邮箱不存在时抛出 EMAIL_NOT_EXISTS。
     */
    public void forgotPassword(String email) {
        if (!StringUtils.hasText(email)) {
            throw new BusinessException(ErrorCode.EMAIL_NOT_EXISTS);
        }
        User user = userService.findByEmail(IdentifierValidator.normalizeEmail(email))
                .orElseThrow(() -> new BusinessException(ErrorCode.EMAIL_NOT_EXISTS));
        SignedToken token = purposeTokenService.issuePasswordReset(user.getId());
        mailNotifier.sendForgotPassword(user.getEmail(), token.value(), token.expiresAt());
    }

    /**
     * 使用重置令牌设置新密码，并使账号全部会话失效。
     *
     * @param request 重置请求，包含：令牌与新密码。
     * @throws BusinessException 密码不合规、令牌无效或账号不存在时抛出。
     */
    public void resetPassword(PasswordResetRequest request) {
        validatePassword(request.password());
        purposeTokenService.resetPassword(request.hash(), request.password());
    }

    /**
     * 使用刷新令牌获取新的令牌对，旧刷新令牌随即失效。
     *
     * @param request 刷新请求，包含：refreshToken。
     * @return 新的令牌响应。
     * @throws BusinessException 任何失败均抛出 UNAUTHORIZED。
     */
    public TokenResponse refresh(TokenRefreshRequest request) {
        TokenPair tokenPair = tokenIssuer.refresh(request.refreshToken());
        return new TokenResponse(tokenPair.accessToken(), tokenPair.refreshToken(),
                tokenPair.accessTokenExpiresAt().toEpochMilli());
    }

    /**
     * 登出：删除访问令牌所属的会话。
     *
     * @param userId     账号 ID。
     * @param sessionId  会话 ID。
     * @param clientInfo 客户端信息，用于审计。
     */
    public void logout(long userId, long sessionId, ClientInfo clientInfo) {
        tokenIssuer.logout(sessionId);
        auditSink.record(AuditEvent.builder()
                .userId(userId)
                .action(AuditAction.LOGOUT)
                .success(true)
                .sessionId(sessionId)
                .ip(clientInfo.ip())
                .userAgent(clientInfo.userAgent())
                .build());
    }

    /**
     * 查询当前账号，角色实时推导。
     *
     * @param userId 账号 ID。
     * @return 账号响应。
     * @throws BusinessException 账号不存在时抛出 USER_NOT_FOUND。
     */
    public AuthUserResponse me(long userId) {
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        return mapUser(user, roleResolver.resolve(user));
    }

    /**
     * 更新当前账号。
     * <p>
     * - 修改密码需校验旧密码，成功后撤销当前会话以外的全部会话；
     * - 修改邮箱只发送确认邮件，确认后才写入；
     * - 姓名直接更新。
     *
     * @param userId    账号 ID。
     * @param sessionId 当前会话 ID，修改密码时保留。
     * @param request   更新请求。
     * @return 更新后的账号响应。
     * @throws BusinessException 账号不存在、旧密码缺失或错误、新密码不合规、邮箱格式错误或已被占用时抛出。
     */
    public AuthUserResponse update(long userId, long sessionId, AuthUpdateRequest request) {
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));

        if (StringUtils.hasText(request.password())) {
            if (!StringUtils.hasText(request.oldPassword())) {
                throw new BusinessException(ErrorCode.MISSING_OLD_PASSWORD);
            }
            if (!StringUtils.hasText(user.getPasswordHash())
                    || !passwordEncoder.matches(request.oldPassword(), user.getPasswordHash())) {
                throw new BusinessException(ErrorCode.INCORRECT_OLD_PASSWORD);
            }
            validatePassword(request.password());
            userService.updatePassword(userId, passwordEncoder.encode(request.password()));
            tokenIssuer.revokeAllExcept(userId, sessionId);
        }

        if (StringUtils.hasText(request.email())) {
            if (!IdentifierValidator.isValidEmail(request.email())) {
                throw new BusinessException(ErrorCode.INVALID_EMAIL);
            }
            String newEmail = IdentifierValidator.normalizeEmail(request.email());
            if (!newEmail.equalsIgnoreCase(user.getEmail())) {
                boolean taken = userService.findByEmail(newEmail)
                        .filter(other -> !other.getId().equals(user.getId()))
                        .isPresent();
                if (taken) {
                    throw new BusinessException(ErrorCode.EMAIL_EXISTS);
                }
                SignedToken token = purposeTokenService.issueNewEmailConfirmation(userId, newEmail);
                mailNotifier.sendConfirmNewEmail(newEmail, token.value());
            }
        }

        if (request.name() != null) {
            userService.updateName(userId, request.name());
        }
        return me(userId);
    }

    /**
     * 校验密码策略：非空、去除首尾空白后达到最小长度。
     *
     * @param password 明文密码。
     * @throws BusinessException 当密码不满足策略时抛出。
     */
    private void validatePassword(String password) {
        if (!StringUtils.hasText(password)
                || password.trim().length() < authProperties.getPassword().getMinLength()) {
            throw new BusinessException(ErrorCode.PASSWORD_POLICY_VIOLATION);
        }
    }

    private void auditLogin(Long userId, String identifier, boolean success, String failureReason,
                            Long sessionId, ClientInfo clientInfo) {
        auditSink.record(AuditEvent.builder()
                .userId(userId)
                .action(AuditAction.LOGIN)
                .success(success)
                .failureReason(failureReason)
                .sessionId(sessionId)
                .identifier(identifier)
                .ip(clientInfo.ip())
                .userAgent(clientInfo.userAgent())
                .build());
    }

    /**
     * 映射账号与角色到响应对象。
     *
     * @param user 账号。
     * @param role 实时推导的角色。
     * @return 账号响应。
     */
    private AuthUserResponse mapUser(User user, Role role) {
        return new AuthUserResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getName(),
                Boolean.TRUE.equals(user.getEnabled()),
                user.getProvider(),
                user.getLastLogin(),
                role.name(),
                role
        );
    }
}
