package com.saddlery.auth.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 开发/测试用邮件发送器。
 * <p>
 * 不实际发送，仅记录收件人与过期时间，令牌本身不写日志。
 */
@Slf4j
@Component
public class LoggingMailNotifier implements MailNotifier {

    @Override
    public void sendConfirmEmail(String email, String hash) {
        log.info("Send confirm-email mail to={}", email);
    }

    @Override
    public void sendConfirmNewEmail(String newEmail, String hash) {
        log.info("Send confirm-new-email mail to={}", newEmail);
    }

    @Override
    public void sendForgotPassword(String email, String hash, Instant tokenExpires) {
        log.info("Send forgot-password mail to={} tokenExpires={}", email, tokenExpires);
    }
}
