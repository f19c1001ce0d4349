package com.saddlery.auth.token;

import java.time.Instant;

/**
 * 已签名的令牌及其签发、过期时间。
 */
public record SignedToken(String value, Instant issuedAt, Instant expiresAt) {
}
