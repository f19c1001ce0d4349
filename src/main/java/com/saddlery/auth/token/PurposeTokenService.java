package com.saddlery.auth.token;

import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 限定用途的一次性令牌（邮箱确认、新邮箱确认、找回密码）。
 * <p>
 * 令牌只携带账号 ID 与必要参数，用途由签名密钥与 `token_type` 共同约束，
 * 任一用途的令牌不能用于另一用途。校验失败（签名、过期、格式、用途、声明缺失）
 * 一律返回 {@link ErrorCode#INVALID_HASH}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurposeTokenService {

    static final String CLAIM_CONFIRM_USER_ID = "confirmUserId";
    static final String CLAIM_NEW_EMAIL = "newEmail";
    static final String CLAIM_FORGOT_USER_ID = "forgotUserId";

    private final TokenSigner tokenSigner;
    private final UserService userService;
    private final TokenIssuer tokenIssuer;
    private final PasswordEncoder passwordEncoder;

    public SignedToken issueEmailConfirmation(long userId) {
        return tokenSigner.sign(TokenPurpose.CONFIRM_EMAIL, Map.of(CLAIM_CONFIRM_USER_ID, userId));
    }

    /**
     * 确认注册邮箱并启用账号。
     *
     * @param hash 确认令牌。
     * @throws BusinessException 令牌无效时抛出 INVALID_HASH；账号不存在或已启用时抛出 ACCOUNT_NOT_FOUND。
     */
    public void confirmEmail(String hash) {
        long userId = readLong(TokenPurpose.CONFIRM_EMAIL, hash, CLAIM_CONFIRM_USER_ID);
        User user = userService.findById(userId)
                .filter(u -> !Boolean.TRUE.equals(u.getEnabled()))
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCOUNT_NOT_FOUND));
        userService.enable(user.getId());
        log.info("Email confirmed userId={}", user.getId());
    }

    public SignedToken issueNewEmailConfirmation(long userId, String newEmail) {
        return tokenSigner.sign(TokenPurpose.CONFIRM_NEW_EMAIL,
                Map.of(CLAIM_CONFIRM_USER_ID, userId, CLAIM_NEW_EMAIL, newEmail));
    }

    /**
     * 确认新邮箱：写入令牌中的邮箱并启用账号。
     *
     * @param hash 确认令牌。
     * @throws BusinessException 令牌无效时抛出 INVALID_HASH；账号不存在时抛出 ACCOUNT_NOT_FOUND。
     */
    public void confirmNewEmail(String hash) {
        Jwt jwt = verify(TokenPurpose.CONFIRM_NEW_EMAIL, hash);
        long userId;
        String newEmail;
        try {
            userId = TokenSigner.requireLong(jwt, CLAIM_CONFIRM_USER_ID);
            newEmail = TokenSigner.requireText(jwt, CLAIM_NEW_EMAIL);
        } catch (InvalidTokenException ex) {
            throw new BusinessException(ErrorCode.INVALID_HASH);
        }
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCOUNT_NOT_FOUND));
        userService.updateEmailAndEnable(user.getId(), newEmail);
        log.info("New email confirmed userId={}", user.getId());
    }

    public SignedToken issuePasswordReset(long userId) {
        return tokenSigner.sign(TokenPurpose.FORGOT_PASSWORD, Map.of(CLAIM_FORGOT_USER_ID, userId));
    }

    /**
     * 使用找回密码令牌重置密码。
     * <p>
     * 先撤销账号全部会话，再写入新的密码哈希。密码策略由调用方校验。
     *
     * @param hash     找回密码令牌。
     * @param password 新的明文密码。
     * @throws BusinessException 令牌无效时抛出 INVALID_HASH；账号不存在时抛出 HASH_ACCOUNT_NOT_FOUND。
     */
    public void resetPassword(String hash, String password) {
        long userId = readLong(TokenPurpose.FORGOT_PASSWORD, hash, CLAIM_FORGOT_USER_ID);
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.HASH_ACCOUNT_NOT_FOUND));
        tokenIssuer.revokeAll(user.getId());
        userService.updatePassword(user.getId(), passwordEncoder.encode(password));
        log.info("Password reset userId={}", user.getId());
    }

    private long readLong(TokenPurpose purpose, String hash, String claim) {
        Jwt jwt = verify(purpose, hash);
        try {
            return TokenSigner.requireLong(jwt, claim);
        } catch (InvalidTokenException ex) {
            throw new BusinessException(ErrorCode.INVALID_HASH);
        }
    }

    private Jwt verify(TokenPurpose purpose, String hash) {
        try {
            return tokenSigner.verify(purpose, hash);
        } catch (InvalidTokenException ex) {
            log.debug("Purpose token rejected purpose={}: {}", purpose, ex.getMessage());
            throw new BusinessException(ErrorCode.INVALID_HASH);
        }
    }
}
