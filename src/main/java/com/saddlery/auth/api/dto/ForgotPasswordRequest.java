package com.saddlery.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(@NotBlank(message = "邮箱不能为空") String email) {
}
