package com.saddlery.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 认证相关配置属性，绑定前缀 {@code auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Tokens：各用途令牌的签名密钥与有效期，彼此独立，可单独轮换；
 * - Password：密码策略与加密强度配置；
 * - Lockout：连续登录失败后的锁定策略；
 * - Audit：审计事件异步写入线程池；
 * - Roles：角色目录缓存。
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** 令牌配置项。 */
    private final Tokens tokens = new Tokens();
    /** 密码策略配置项。 */
    private final Password password = new Password();
    /** 账号锁定配置项。 */
    private final Lockout lockout = new Lockout();
    /** 审计写入配置项。 */
    private final Audit audit = new Audit();
    /** 角色目录配置项。 */
    private final Roles roles = new Roles();

    /**
     * 四类令牌：访问令牌、刷新令牌、邮箱确认令牌、找回密码令牌。
     */
    @Data
    public static class Tokens {
        /** JWT 签发者标识（iss）。 */
        private String issuer = "saddlery";
        private final TokenSettings access = new TokenSettings(Duration.ofMinutes(15));
        private final TokenSettings refresh = new TokenSettings(Duration.ofDays(30));
        private final TokenSettings confirmEmail = new TokenSettings(Duration.ofDays(1));
        private final TokenSettings forgotPassword = new TokenSettings(Duration.ofMinutes(30));
    }

    /** 单一用途令牌的 HMAC 密钥（至少 32 字节）与有效期。 */
    @Data
    public static class TokenSettings {
        private String secret;
        private Duration ttl;

        public TokenSettings() {
        }

        public TokenSettings(Duration ttl) {
            this.ttl = ttl;
        }

        public TokenSettings(String secret, Duration ttl) {
            this.secret = secret;
            this.ttl = ttl;
        }
    }

    /** 密码策略配置。 */
    @Data
    public static class Password {
        /** 密码哈希强度（BCrypt cost）。 */
        private int bcryptStrength = 10;
        /** 密码最小长度。 */
        private int minLength = 6;
    }

    /**
     * 锁定策略：连续失败达到阈值后锁定一段时间，锁定期间无论密码是否正确均拒绝登录。
     */
    @Data
    public static class Lockout {
        /** 触发锁定的连续失败次数，小于等于 0 表示不自动锁定。 */
        private int maxFailedAttempts = 5;
        /** 锁定时长。 */
        private Duration lockDuration = Duration.ofMinutes(15);
    }

    /** 审计异步写入线程池。 */
    @Data
    public static class Audit {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        /** 队列满时新事件直接丢弃。 */
        private int queueCapacity = 1000;
    }

    @Data
    public static class Roles {
        /** 角色名到 ID 映射的缓存时间。 */
        private Duration catalogTtl = Duration.ofMinutes(10);
    }
}
