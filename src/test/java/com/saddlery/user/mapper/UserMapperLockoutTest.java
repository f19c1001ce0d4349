package com.saddlery.user.mapper;

import com.saddlery.user.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 在真实 MySQL 上执行失败计数与锁定 SQL，覆盖阈值前后与锁定过期后的计数重置。
 */
@MybatisTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class UserMapperLockoutTest {

    private static final int MAX_ATTEMPTS = 3;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant LOCK_UNTIL = NOW.plus(Duration.ofMinutes(15));

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>(DockerImageName.parse("mysql:8.0"))
            .withInitScript("db/schema.sql")
            .withUrlParam("serverTimezone", "UTC");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
    }

    @Autowired
    private UserMapper userMapper;

    private Long userId;

    @BeforeEach
    void insertAccount() {
        User user = User.builder()
                .username("adamwhitehouse")
                .email("adam@example.com")
                .passwordHash("$2a$04$placeholder")
                .enabled(true)
                .provider("email")
                .userType(1)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
        userMapper.insert(user);
        userId = user.getId();
    }

    @Test
    void registerFailedLogin_belowThreshold_countsWithoutLocking() {
        for (int i = 0; i < MAX_ATTEMPTS - 1; i++) {
            userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL);
        }

        User user = userMapper.findById(userId);
        assertThat(user.getFailedLoginAttempts()).isEqualTo(MAX_ATTEMPTS - 1);
        assertThat(user.getLockedUntil()).isNull();
    }

    @Test
    void registerFailedLogin_reachingThreshold_setsLockInSameStatement() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL);
        }

        User user = userMapper.findById(userId);
        assertThat(user.getFailedLoginAttempts()).isEqualTo(MAX_ATTEMPTS);
        assertThat(user.getLockedUntil()).isEqualTo(LOCK_UNTIL);
    }

    @Test
    void clearExpiredLock_onlyAfterExpiry_thenCountingRestartsFromZero() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL);
        }

        assertThat(userMapper.clearExpiredLock(userId, LOCK_UNTIL.minusSeconds(1))).isZero();
        assertThat(userMapper.findById(userId).getLockedUntil()).isEqualTo(LOCK_UNTIL);

        assertThat(userMapper.clearExpiredLock(userId, LOCK_UNTIL.plusSeconds(1))).isEqualTo(1);
        User cleared = userMapper.findById(userId);
        assertThat(cleared.getFailedLoginAttempts()).isZero();
        assertThat(cleared.getLockedUntil()).isNull();
        assertThat(userMapper.clearExpiredLock(userId, LOCK_UNTIL.plusSeconds(1))).isZero();

        userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL.plus(Duration.ofHours(1)));
        User afterOneFailure = userMapper.findById(userId);
        assertThat(afterOneFailure.getFailedLoginAttempts()).isEqualTo(1);
        assertThat(afterOneFailure.getLockedUntil()).isNull();
    }

    @Test
    void registerSuccessfulLogin_resetsCounterAndStampsLastLogin() {
        userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL);
        userMapper.registerFailedLogin(userId, MAX_ATTEMPTS, LOCK_UNTIL);

        userMapper.registerSuccessfulLogin(userId, NOW);

        User user = userMapper.findById(userId);
        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.getLastLogin()).isEqualTo(NOW);
    }
}
