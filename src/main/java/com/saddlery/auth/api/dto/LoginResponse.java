package com.saddlery.auth.api.dto;

/**
 * 登录响应。
 * <p>
 * `tokenExpires` 为访问令牌过期时间（epoch 毫秒），客户端据此在过期前调用刷新接口。
 */
public record LoginResponse(
        String token,
        String refreshToken,
        long tokenExpires,
        AuthUserResponse user
) {
}
