package com.saddlery.user.service;

import com.saddlery.user.domain.User;

import java.time.Instant;
import java.util.Optional;

/**
 * 账号领域服务接口。
 * <p>
 * enabled、lockedUntil、failedLoginAttempts 与 passwordHash 仅由认证模块通过本接口写入。
 */
public interface UserService {

    Optional<User> findById(long id);

    Optional<User> findByEmail(String email);

    Optional<User> findByEmailOrUsername(String identifier);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    User createUser(User user);

    void updatePassword(long id, String passwordHash);

    void updateName(long id, String name);

    void enable(long id);

    void updateEmailAndEnable(long id, String email);

    /**
     * 清除已过期的锁定并重置失败计数。
     *
     * @return 本次调用是否实际清除了锁定。
     */
    boolean clearExpiredLock(long id, Instant now);

    /**
     * 原子地累加失败计数，达到阈值时写入锁定截止时间。
     */
    void registerFailedLogin(long id, int maxAttempts, Instant lockUntil);

    void registerSuccessfulLogin(long id, Instant now);
}
