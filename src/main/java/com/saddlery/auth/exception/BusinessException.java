package com.saddlery.auth.exception;

import lombok.Getter;

/**
 * 认证业务异常。
 * <p>
 * 携带 {@link ErrorCode} 与可选的明细（例如需要改用的第三方登录渠道名），
 * 由 {@code GlobalExceptionHandler} 统一转换为响应体。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, null);
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail == null ? errorCode.getReason() : errorCode.getReason() + ":" + detail);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    /**
     * 返回给客户端的原因码，明细存在时以冒号拼接，例如 {@code needLoginViaProvider:google}。
     *
     * @return 原因码。
     */
    public String reasonCode() {
        return getMessage();
    }
}
