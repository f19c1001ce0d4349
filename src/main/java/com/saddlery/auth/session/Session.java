package com.saddlery.auth.session;

import java.time.Instant;

/**
 * 登录会话。
 * <p>
 * 每个会话在任一时刻只有一个有效的 hash；刷新时原子替换，旧 hash 立即失效。
 *
 * @param id        会话 ID。
 * @param userId    所属账号 ID。
 * @param hash      当前有效的会话 hash。
 * @param createdAt 创建时间。
 */
public record Session(long id, long userId, String hash, Instant createdAt) {
}
