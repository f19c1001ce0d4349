package com.saddlery.auth.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class IdentifierValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}$", Pattern.CASE_INSENSITIVE);

    private IdentifierValidator() {
    }

    /**
     * 校验邮箱格式（大小写不敏感，允许首尾空白）。
     *
     * @param email 邮箱字符串。
     * @return 是否匹配邮箱正则。
     */
    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email.trim()).matches();
    }

    /**
     * 标准化邮箱：去空格并转小写。
     *
     * @param email 原始邮箱。
     * @return 标准化后的邮箱。
     */
    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
