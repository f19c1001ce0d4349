package com.saddlery.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 邮箱注册请求。
 * <p>
 * `username` 缺省时使用邮箱；注册后账号处于未启用状态，需通过确认邮件启用。
 */
public record RegisterRequest(
        @NotBlank(message = "邮箱不能为空") String email,
        @NotBlank(message = "密码不能为空") String password,
        String username,
        String name
) {
}
