package com.saddlery.auth.config;

import com.saddlery.auth.token.TokenPurpose;
import com.saddlery.auth.token.TokenSigner;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.time.Clock;

/**
 * 认证相关 Bean 配置。
 * <p>
 * - `Clock`：统一时间来源，测试中可替换；
 * - `PasswordEncoder`：根据配置的 BCrypt 强度创建；
 * - `TokenSigner`：按用途持有 HS256 密钥与有效期，启动时校验配置；
 * - `JwtDecoder`：资源服务器只接受访问令牌；
 * - `auditExecutor`：审计写入专用的有界线程池。
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
@RequiredArgsConstructor
public class AuthConfiguration {

    private final AuthProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 创建密码编码器（BCrypt）。
     *
     * @return 使用配置的强度构造的 {@link PasswordEncoder}。
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(properties.getPassword().getBcryptStrength());
    }

    /**
     * 创建令牌签名器。密钥缺失、过短或有效期非正时启动失败。
     *
     * @param clock 时间来源。
     * @return {@link TokenSigner}。
     */
    @Bean
    public TokenSigner tokenSigner(Clock clock) {
        return new TokenSigner(properties.getTokens(), clock);
    }

    /**
     * 资源服务器使用的 JWT 解码器，仅接受 `token_type=access` 的令牌。
     *
     * @param tokenSigner 令牌签名器。
     * @return 访问令牌解码器。
     */
    @Bean
    public JwtDecoder jwtDecoder(TokenSigner tokenSigner) {
        return tokenSigner.decoder(TokenPurpose.ACCESS);
    }

    /**
     * 审计写入线程池。队列满时提交方收到 TaskRejectedException，由调用方丢弃事件。
     *
     * @return 有界线程池。
     */
    @Bean("auditExecutor")
    public TaskExecutor auditExecutor() {
        AuthProperties.Audit audit = properties.getAudit();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(audit.getCorePoolSize());
        executor.setMaxPoolSize(audit.getMaxPoolSize());
        executor.setQueueCapacity(audit.getQueueCapacity());
        executor.setThreadNamePrefix("audit-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
