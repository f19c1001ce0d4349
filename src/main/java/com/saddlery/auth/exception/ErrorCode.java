package com.saddlery.auth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    IDENTIFIER_NOT_FOUND(ErrorKind.NOT_FOUND, "email", "notFound", HttpStatus.UNPROCESSABLE_ENTITY),
    WRONG_PROVIDER(ErrorKind.BUSINESS_RULE, "email", "needLoginViaProvider", HttpStatus.UNPROCESSABLE_ENTITY),
    ACCOUNT_LOCKED(ErrorKind.BUSINESS_RULE, "account", "locked", HttpStatus.UNPROCESSABLE_ENTITY),
    INCORRECT_PASSWORD(ErrorKind.BUSINESS_RULE, "password", "incorrectPassword", HttpStatus.UNPROCESSABLE_ENTITY),
    PASSWORD_POLICY_VIOLATION(ErrorKind.BUSINESS_RULE, "password", "passwordTooWeak", HttpStatus.UNPROCESSABLE_ENTITY),
    EMAIL_EXISTS(ErrorKind.BUSINESS_RULE, "email", "emailAlreadyExists", HttpStatus.UNPROCESSABLE_ENTITY),
    USERNAME_EXISTS(ErrorKind.BUSINESS_RULE, "username", "usernameAlreadyExists", HttpStatus.UNPROCESSABLE_ENTITY),
    EMAIL_NOT_EXISTS(ErrorKind.NOT_FOUND, "email", "emailNotExists", HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_EMAIL(ErrorKind.BUSINESS_RULE, "email", "invalidEmail", HttpStatus.UNPROCESSABLE_ENTITY),
    MISSING_OLD_PASSWORD(ErrorKind.BUSINESS_RULE, "oldPassword", "missingOldPassword", HttpStatus.UNPROCESSABLE_ENTITY),
    INCORRECT_OLD_PASSWORD(ErrorKind.BUSINESS_RULE, "oldPassword", "incorrectOldPassword", HttpStatus.UNPROCESSABLE_ENTITY),
    USER_NOT_FOUND(ErrorKind.NOT_FOUND, "user", "userNotFound", HttpStatus.UNPROCESSABLE_ENTITY),
    ACCOUNT_NOT_FOUND(ErrorKind.NOT_FOUND, null, "notFound", HttpStatus.NOT_FOUND),
    HASH_ACCOUNT_NOT_FOUND(ErrorKind.NOT_FOUND, "hash", "notFound", HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_HASH(ErrorKind.INVALID_TOKEN, "hash", "invalidHash", HttpStatus.UNPROCESSABLE_ENTITY),
    UNAUTHORIZED(ErrorKind.UNAUTHORIZED, null, "Unauthorized", HttpStatus.UNAUTHORIZED);

    private final ErrorKind kind;
    /** 响应体 errors 中的字段名；为空时以 error/message 形式返回。 */
    private final String field;
    private final String reason;
    private final HttpStatus status;

    ErrorCode(ErrorKind kind, String field, String reason, HttpStatus status) {
        this.kind = kind;
        this.field = field;
        this.reason = reason;
        this.status = status;
    }
}
