package com.saddlery.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 重置密码请求。
 * <p>
 * 通过找回密码邮件中的令牌校验身份后设置新密码。密码需满足长度策略。
 */
public record PasswordResetRequest(
        @NotBlank(message = "hash 不能为空") String hash,
        @NotBlank(message = "新密码不能为空") String password
) {
}
