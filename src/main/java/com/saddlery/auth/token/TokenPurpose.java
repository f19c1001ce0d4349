package com.saddlery.auth.token;

/**
 * 令牌用途。每种用途对应独立的签名密钥、有效期与 {@code token_type} 声明值，
 * 某一用途签发的令牌无法通过其它用途的校验。
 */
public enum TokenPurpose {
    ACCESS("access"),
    REFRESH("refresh"),
    CONFIRM_EMAIL("confirm-email"),
    CONFIRM_NEW_EMAIL("confirm-new-email"),
    FORGOT_PASSWORD("forgot-password");

    private final String tokenType;

    TokenPurpose(String tokenType) {
        this.tokenType = tokenType;
    }

    public String tokenType() {
        return tokenType;
    }
}
