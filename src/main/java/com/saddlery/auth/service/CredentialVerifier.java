package com.saddlery.auth.service;

import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.auth.model.AuthProvider;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * 凭证校验。
 * <p>
 * 校验顺序：账号存在 → 登录渠道为 email → 未处于锁定（过期锁定先清除）→ 已设置密码 → BCrypt 比对。
 * 未设置密码与密码错误返回同一错误码。本类不累加失败计数，由调用方通过 {@link LockoutGuard} 显式记录。
 */
@Service
@RequiredArgsConstructor
public class CredentialVerifier {

    private final UserService userService;
    private final LockoutGuard lockoutGuard;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    /**
     * 按标识与密码校验账号。
     *
     * @param identifier 邮箱或用户名。
     * @param password   明文密码。
     * @return 校验通过的账号。
     * @throws BusinessException 账号不存在、渠道不符、已锁定或密码错误时抛出。
     */
    public User verify(String identifier, String password) {
        User user = resolveAccount(identifier);
        checkCredentials(user, password);
        return user;
    }

    /**
     * 按邮箱（大小写不敏感）或用户名查找账号。
     *
     * @param identifier 邮箱或用户名。
     * @return 账号。
     * @throws BusinessException 账号不存在时抛出 {@link ErrorCode#IDENTIFIER_NOT_FOUND}。
     */
    public User resolveAccount(String identifier) {
        if (!StringUtils.hasText(identifier)) {
            throw new BusinessException(ErrorCode.IDENTIFIER_NOT_FOUND);
        }
        return userService.findByEmailOrUsername(identifier.trim())
                .orElseThrow(() -> new BusinessException(ErrorCode.IDENTIFIER_NOT_FOUND));
    }

    /**
     * 对已找到的账号执行渠道、锁定与密码校验。
     *
     * @param user     账号。
     * @param password 明文密码。
     * @throws BusinessException 渠道不符、已锁定或密码错误时抛出。
     */
    public void checkCredentials(User user, String password) {
        if (!AuthProvider.isPasswordProvider(user.getProvider())) {
            throw new BusinessException(ErrorCode.WRONG_PROVIDER, user.getProvider());
        }
        Instant now = Instant.now(clock);
        if (lockoutGuard.isLocked(user, now)) {
            throw new BusinessException(ErrorCode.ACCOUNT_LOCKED);
        }
        lockoutGuard.clearIfExpired(user, now);
        if (!StringUtils.hasText(user.getPasswordHash())) {
            throw new BusinessException(ErrorCode.INCORRECT_PASSWORD);
        }
        if (password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new BusinessException(ErrorCode.INCORRECT_PASSWORD);
        }
    }
}
