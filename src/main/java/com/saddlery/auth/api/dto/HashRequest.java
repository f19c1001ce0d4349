package com.saddlery.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 携带用途令牌的请求（确认邮箱、确认新邮箱）。
 */
public record HashRequest(@NotBlank(message = "hash 不能为空") String hash) {
}
