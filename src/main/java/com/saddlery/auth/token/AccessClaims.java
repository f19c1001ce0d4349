package com.saddlery.auth.token;

import com.saddlery.role.domain.Role;
import com.saddlery.user.domain.User;

/**
 * 访问令牌中携带的账号信息。username 与 enabled 仅供客户端展示。
 */
public record AccessClaims(long userId, Role role, String username, boolean enabled) {

    public static AccessClaims of(User user, Role role) {
        return new AccessClaims(user.getId(), role, user.getUsername(), Boolean.TRUE.equals(user.getEnabled()));
    }
}
