package com.saddlery.auth.service;

import com.saddlery.auth.config.AuthProperties;
import com.saddlery.user.domain.User;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * 账号锁定守卫。
 * <p>
 * 自身不持有状态，只读写账号上的 lockedUntil 与 failedLoginAttempts：
 * - lockedUntil 存在且晚于当前时间即视为锁定；
 * - 锁定已过期时在继续登录前清除锁定并重置计数；
 * - 失败计数的累加与锁定写入由存储层单条语句原子完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockoutGuard {

    private final UserService userService;
    private final AuthProperties properties;

    public boolean isLocked(User user, Instant now) {
        return user.getLockedUntil() != null && user.getLockedUntil().isAfter(now);
    }

    /**
     * 锁定已过期时清除锁定。重复调用幂等。
     *
     * @param user 账号，清除成功后同步更新内存中的字段。
     * @param now  当前时间。
     * @return 是否存在已过期的锁定。
     */
    public boolean clearIfExpired(User user, Instant now) {
        if (user.getLockedUntil() == null || user.getLockedUntil().isAfter(now)) {
            return false;
        }
        if (userService.clearExpiredLock(user.getId(), now)) {
            log.info("Expired lockout cleared userId={}", user.getId());
        }
        user.setLockedUntil(null);
        user.setFailedLoginAttempts(0);
        return true;
    }

    /**
     * 记录一次密码错误；连续失败达到 `auth.lockout.max-failed-attempts` 时锁定 `lock-duration`。
     *
     * @param user 账号。
     * @param now  当前时间。
     */
    public void recordFailure(User user, Instant now) {
        AuthProperties.Lockout lockout = properties.getLockout();
        Instant lockUntil = now.plus(lockout.getLockDuration());
        userService.registerFailedLogin(user.getId(), lockout.getMaxFailedAttempts(), lockUntil);
        int attempts = (user.getFailedLoginAttempts() == null ? 0 : user.getFailedLoginAttempts()) + 1;
        if (lockout.getMaxFailedAttempts() > 0 && attempts >= lockout.getMaxFailedAttempts()) {
            log.warn("Account locked after {} failed logins userId={} until={}", attempts, user.getId(), lockUntil);
        }
    }

    /**
     * 登录成功：重置失败计数并记录登录时间。
     *
     * @param user 账号。
     * @param now  当前时间。
     */
    public void recordSuccess(User user, Instant now) {
        userService.registerSuccessfulLogin(user.getId(), now);
    }
}
