package com.saddlery.auth.api.dto;

/**
 * 更新当前账号资料。
 * <p>
 * 字段均可选：
 * - 修改密码时必须同时提供 `oldPassword`；
 * - 修改邮箱不会立即生效，需通过发往新邮箱的确认邮件完成。
 */
public record AuthUpdateRequest(
        String name,
        String email,
        String password,
        String oldPassword
) {
}
