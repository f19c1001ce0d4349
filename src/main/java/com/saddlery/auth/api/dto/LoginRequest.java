package com.saddlery.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 邮箱/用户名密码登录请求。
 * <p>
 * `identifier` 可以是邮箱（大小写不敏感）或用户名。
 */
public record LoginRequest(
        @NotBlank(message = "账号不能为空") String identifier,
        @NotBlank(message = "密码不能为空") String password
) {
}
