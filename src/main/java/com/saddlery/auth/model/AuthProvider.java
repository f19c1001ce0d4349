package com.saddlery.auth.model;

import java.util.Locale;

/**
 * 账号来源渠道。只有 EMAIL 渠道的账号可以使用密码登录。
 */
public enum AuthProvider {
    EMAIL("email"),
    GOOGLE("google"),
    FACEBOOK("facebook"),
    APPLE("apple");

    private final String tag;

    AuthProvider(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * 判断存储的渠道标记是否为密码渠道，大小写不敏感。
     *
     * @param provider 账号上的渠道标记。
     * @return 是否为 email 渠道。
     */
    public static boolean isPasswordProvider(String provider) {
        return provider != null && EMAIL.tag.equals(provider.trim().toLowerCase(Locale.ROOT));
    }
}
