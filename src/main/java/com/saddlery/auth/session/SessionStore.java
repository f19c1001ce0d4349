package com.saddlery.auth.session;

import java.util.Optional;

/**
 * 会话存储接口。
 * <p>
 * 负责会话的创建、查询、hash 轮换与删除。hash 轮换必须是比较并交换：
 * 仅当当前 hash 与期望值一致时写入新值，并发刷新中只有一个能成功。
 * 实现可使用 Redis、数据库或其它持久化方案。
 */
public interface SessionStore {

    /**
     * 创建会话。
     *
     * @param userId 账号 ID。
     * @param hash   初始会话 hash。
     * @return 新会话。
     */
    Session create(long userId, String hash);

    /**
     * 查询会话。
     *
     * @param sessionId 会话 ID。
     * @return 会话 Optional，不存在或已过期时为空。
     */
    Optional<Session> findById(long sessionId);

    /**
     * 比较并交换会话 hash。
     *
     * @param sessionId    会话 ID。
     * @param expectedHash 期望的当前 hash。
     * @param newHash      新 hash。
     * @return 是否替换成功；会话不存在或 hash 已变化时返回 false。
     */
    boolean compareAndSwapHash(long sessionId, String expectedHash, String newHash);

    /**
     * 删除单个会话。
     *
     * @param sessionId 会话 ID。
     */
    void deleteById(long sessionId);

    /**
     * 删除账号的全部会话（强制所有设备重新登录）。
     *
     * @param userId 账号 ID。
     */
    void deleteByUserId(long userId);

    /**
     * 删除账号除指定会话外的全部会话。
     *
     * @param userId        账号 ID。
     * @param keepSessionId 保留的会话 ID。
     */
    void deleteByUserIdExcept(long userId, long keepSessionId);
}
