package com.saddlery.auth.api.dto;

import com.saddlery.role.domain.Role;

import java.time.Instant;

/**
 * 认证用户响应。
 * <p>
 * 面向客户端展示的账号信息，`typeName` 与 `role` 为本次请求实时计算的角色。
 */
public record AuthUserResponse(
        Long id,
        String username,
        String email,
        String name,
        boolean enabled,
        String provider,
        Instant lastLogin,
        String typeName,
        Role role
) {
}
