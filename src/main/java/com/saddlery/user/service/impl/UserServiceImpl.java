package com.saddlery.user.service.impl;

import com.saddlery.user.domain.User;
import com.saddlery.user.mapper.UserMapper;
import com.saddlery.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserMapper userMapper;
    private final Clock clock;

    /**
     * 根据 ID 查询账号。
     *
     * @param id 账号 ID。
     * @return 账号 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    /**
     * 根据邮箱查询账号（大小写不敏感）。
     *
     * @param email 邮箱地址。
     * @return 账号 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(userMapper.findByEmail(email));
    }

    /**
     * 根据邮箱或用户名查询账号。
     *
     * @param identifier 邮箱或用户名。
     * @return 账号 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmailOrUsername(String identifier) {
        return Optional.ofNullable(userMapper.findByEmailOrUsername(identifier));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return userMapper.existsByEmail(email);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return userMapper.existsByUsername(username);
    }

    /**
     * 创建账号，写入创建与更新时间并持久化。
     *
     * @param user 待创建的账号实体。
     * @return 持久化后的账号实体（含生成的 ID）。
     */
    @Override
    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now(clock);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);
        return user;
    }

    @Override
    @Transactional
    public void updatePassword(long id, String passwordHash) {
        userMapper.updatePassword(id, passwordHash, Instant.now(clock));
    }

    @Override
    @Transactional
    public void updateName(long id, String name) {
        userMapper.updateName(id, name, Instant.now(clock));
    }

    @Override
    @Transactional
    public void enable(long id) {
        userMapper.enable(id, Instant.now(clock));
    }

    @Override
    @Transactional
    public void updateEmailAndEnable(long id, String email) {
        userMapper.updateEmailAndEnable(id, email, Instant.now(clock));
    }

    @Override
    @Transactional
    public boolean clearExpiredLock(long id, Instant now) {
        return userMapper.clearExpiredLock(id, now) > 0;
    }

    @Override
    @Transactional
    public void registerFailedLogin(long id, int maxAttempts, Instant lockUntil) {
        userMapper.registerFailedLogin(id, maxAttempts, lockUntil);
    }

    @Override
    @Transactional
    public void registerSuccessfulLogin(long id, Instant now) {
        userMapper.registerSuccessfulLogin(id, now);
    }
}
