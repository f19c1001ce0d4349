package com.saddlery.auth.api.dto;

/**
 * 令牌响应。
 * <p>
 * 返回新的访问令牌、刷新令牌与访问令牌过期时间（epoch 毫秒）；旧刷新令牌已失效。
 */
public record TokenResponse(
        String token,
        String refreshToken,
        long tokenExpires
) {
}
