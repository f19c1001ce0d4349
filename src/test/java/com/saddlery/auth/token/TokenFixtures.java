package com.saddlery.auth.token;

import com.saddlery.auth.config.AuthProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 测试用令牌配置：各用途独立密钥，有效期使用默认值。
 */
public final class TokenFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private TokenFixtures() {
    }

    public static AuthProperties.Tokens tokens() {
        AuthProperties.Tokens tokens = new AuthProperties.Tokens();
        tokens.getAccess().setSecret("access-secret-for-tests-0123456789abcdef");
        tokens.getRefresh().setSecret("refresh-secret-for-tests-0123456789abcdef");
        tokens.getConfirmEmail().setSecret("confirm-email-secret-for-tests-0123456789");
        tokens.getForgotPassword().setSecret("forgot-password-secret-for-tests-012345678");
        return tokens;
    }

    public static Clock clockAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    public static TokenSigner signer(Instant instant) {
        return new TokenSigner(tokens(), clockAt(instant));
    }
}
