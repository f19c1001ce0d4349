package com.saddlery.auth.token;

/**
 * 令牌校验失败。签名错误、过期、格式错误、用途不符均抛出此异常，调用方不应区分具体原因。
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
