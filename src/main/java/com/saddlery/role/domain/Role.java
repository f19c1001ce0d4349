package com.saddlery.role.domain;

/**
 * 授权角色 {id, name}。不存储在账号上，每次认证时由账号属性推导。
 */
public record Role(long id, String name) {
}
