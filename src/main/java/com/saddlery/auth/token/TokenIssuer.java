package com.saddlery.auth.token;

import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.auth.service.RoleResolver;
import com.saddlery.auth.session.Session;
import com.saddlery.auth.session.SessionStore;
import com.saddlery.role.domain.Role;
import com.saddlery.role.domain.RoleName;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 访问/刷新令牌签发与会话轮换。
 * <p>
 * 访问令牌声明：`id`、`role`（{id,name}）、`roles`（前端权限名）、`sessionId`、`username`、`enabled`；
 * 刷新令牌声明：`sessionId`、`hash`。刷新时以比较并交换替换会话 hash：
 * - 旧刷新令牌在轮换成功后立即失效，重放返回 UNAUTHORIZED；
 * - 同一会话的并发刷新只有一个成功；
 * - 角色在每次刷新时重新计算，不沿用旧令牌中的角色。
 * 刷新流程中的任何失败都不区分原因，统一返回 {@link ErrorCode#UNAUTHORIZED}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenIssuer {

    public static final String CLAIM_ID = "id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_SESSION_ID = "sessionId";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ENABLED = "enabled";
    static final String CLAIM_HASH = "hash";

    private static final int HASH_SEED_BYTES = 32;

    private final TokenSigner tokenSigner;
    private final SessionStore sessionStore;
    private final UserService userService;
    private final RoleResolver roleResolver;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * 为账号创建新会话并签发令牌对。
     *
     * @param user 已通过凭证校验的账号。
     * @param role 本次登录解析出的角色。
     * @return 令牌对。
     */
    public TokenPair startSession(User user, Role role) {
        Session session = sessionStore.create(user.getId(), newHash());
        log.info("Session started sessionId={} userId={}", session.id(), user.getId());
        return issuePair(AccessClaims.of(user, role), session.id(), session.hash());
    }

    /**
     * 按给定会话与 hash 签发令牌对，不修改会话。
     *
     * @param claims    访问令牌中的账号信息。
     * @param sessionId 会话 ID。
     * @param hash      会话当前 hash。
     * @return 令牌对。
     */
    public TokenPair issuePair(AccessClaims claims, long sessionId, String hash) {
        Map<String, Object> role = new LinkedHashMap<>();
        role.put("id", claims.role().id());
        role.put("name", claims.role().name());

        Map<String, Object> accessClaims = new LinkedHashMap<>();
        accessClaims.put(CLAIM_ID, claims.userId());
        accessClaims.put(CLAIM_ROLE, role);
        accessClaims.put(CLAIM_ROLES, List.of(RoleName.fromValue(claims.role().name()).authority()));
        accessClaims.put(CLAIM_SESSION_ID, sessionId);
        if (claims.username() != null) {
            accessClaims.put(CLAIM_USERNAME, claims.username());
        }
        accessClaims.put(CLAIM_ENABLED, claims.enabled());
        SignedToken access = tokenSigner.sign(TokenPurpose.ACCESS, accessClaims);

        Map<String, Object> refreshClaims = new LinkedHashMap<>();
        refreshClaims.put(CLAIM_SESSION_ID, sessionId);
        refreshClaims.put(CLAIM_HASH, hash);
        SignedToken refresh = tokenSigner.sign(TokenPurpose.REFRESH, refreshClaims);

        return new TokenPair(access.value(), access.expiresAt(), refresh.value(), refresh.expiresAt(), sessionId);
    }

    /**
     * 使用刷新令牌轮换会话并签发新的令牌对。
     *
     * @param refreshToken 刷新令牌字符串。
     * @return 新的令牌对。
     * @throws BusinessException 令牌无效、会话不存在、hash 不匹配、账号不存在或并发轮换失败时抛出 UNAUTHORIZED。
     */
    public TokenPair refresh(String refreshToken) {
        long sessionId;
        String presentedHash;
        try {
            Jwt jwt = tokenSigner.verify(TokenPurpose.REFRESH, refreshToken);
            sessionId = TokenSigner.requireLong(jwt, CLAIM_SESSION_ID);
            presentedHash = TokenSigner.requireText(jwt, CLAIM_HASH);
        } catch (InvalidTokenException ex) {
            log.debug("Refresh token rejected: {}", ex.getMessage());
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }

        Session session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED));
        if (!MessageDigest.isEqual(bytes(session.hash()), bytes(presentedHash))) {
            log.warn("Stale refresh token presented sessionId={} userId={}", sessionId, session.userId());
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        User user = userService.findById(session.userId())
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED));
        Role role = roleResolver.resolve(user);

        String nextHash = newHash();
        if (!sessionStore.compareAndSwapHash(sessionId, presentedHash, nextHash)) {
            log.warn("Concurrent refresh lost the rotation sessionId={} userId={}", sessionId, session.userId());
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        return issuePair(AccessClaims.of(user, role), sessionId, nextHash);
    }

    /**
     * 登出：删除会话，之后该会话的刷新令牌全部失效。
     *
     * @param sessionId 会话 ID。
     */
    public void logout(long sessionId) {
        sessionStore.deleteById(sessionId);
        log.info("Session revoked sessionId={}", sessionId);
    }

    /**
     * 撤销账号的全部会话。
     *
     * @param userId 账号 ID。
     */
    public void revokeAll(long userId) {
        sessionStore.deleteByUserId(userId);
        log.info("All sessions revoked userId={}", userId);
    }

    /**
     * 撤销账号除当前会话外的全部会话。
     *
     * @param userId        账号 ID。
     * @param keepSessionId 保留的会话 ID。
     */
    public void revokeAllExcept(long userId, long keepSessionId) {
        sessionStore.deleteByUserIdExcept(userId, keepSessionId);
        log.info("Other sessions revoked userId={} keptSessionId={}", userId, keepSessionId);
    }

    /**
     * 生成新的会话 hash：32 字节随机数的 SHA-256 十六进制串。
     *
     * @return 64 位十六进制字符串。
     */
    String newHash() {
        byte[] seed = new byte[HASH_SEED_BYTES];
        secureRandom.nextBytes(seed);
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(seed));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
