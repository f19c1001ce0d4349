package com.saddlery.auth.mail;

import java.time.Instant;

/**
 * 认证邮件发送接口。
 * <p>
 * 只负责投递令牌，邮件模板与内容不在认证模块内。
 */
public interface MailNotifier {

    /**
     * 发送注册邮箱确认邮件。
     *
     * @param email 收件地址。
     * @param hash  确认令牌。
     */
    void sendConfirmEmail(String email, String hash);

    /**
     * 发送新邮箱确认邮件。
     *
     * @param newEmail 待确认的新邮箱。
     * @param hash     确认令牌。
     */
    void sendConfirmNewEmail(String newEmail, String hash);

    /**
     * 发送找回密码邮件。
     *
     * @param email        收件地址。
     * @param hash         重置令牌。
     * @param tokenExpires 令牌过期时间。
     */
    void sendForgotPassword(String email, String hash, Instant tokenExpires);
}
