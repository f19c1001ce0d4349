package com.saddlery.auth.exception;

/**
 * 错误分类。
 * <p>
 * NOT_FOUND：标识或账号不存在；BUSINESS_RULE：业务规则拒绝（错误的登录渠道、账号锁定、密码错误等）；
 * UNAUTHORIZED：会话或刷新令牌不可用；INVALID_TOKEN：签名令牌校验失败（过期与伪造不作区分）。
 */
public enum ErrorKind {
    NOT_FOUND,
    BUSINESS_RULE,
    UNAUTHORIZED,
    INVALID_TOKEN
}
