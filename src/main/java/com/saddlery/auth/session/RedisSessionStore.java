package com.saddlery.auth.session;

import com.saddlery.auth.config.AuthProperties;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的会话存储。
 * <p>
 * 键空间：
 * - `auth:session:seq`：会话 ID 自增序列；
 * - `auth:session:{id}`：Hash，字段 userId、hash、createdAt（毫秒）；
 * - `auth:session:user:{userId}`：Set，账号下的会话 ID。
 * 会话 TTL 与刷新令牌有效期一致，每次轮换续期。会话写入（Hash、TTL、账号索引）与 hash 轮换
 * 均通过 Lua 脚本原子完成，不会出现没有 TTL 或不在账号索引中的会话。
 */
@Component
public class RedisSessionStore implements SessionStore {

    private static final String FIELD_USER_ID = "userId";
    private static final String FIELD_HASH = "hash";
    private static final String FIELD_CREATED_AT = "createdAt";

    private static final String CREATE_LUA = """
            redis.call('HSET', KEYS[1], 'userId', ARGV[1], 'hash', ARGV[2], 'createdAt', ARGV[3])
            redis.call('PEXPIRE', KEYS[1], ARGV[4])
            redis.call('SADD', KEYS[2], ARGV[5])
            redis.call('PEXPIRE', KEYS[2], ARGV[4])
            return 1
            """;

    private static final String CAS_LUA = """
            local current = redis.call('HGET', KEYS[1], 'hash')
            if current and current == ARGV[1] then
              redis.call('HSET', KEYS[1], 'hash', ARGV[2])
              redis.call('PEXPIRE', KEYS[1], ARGV[3])
              return 1
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> createScript;
    private final DefaultRedisScript<Long> casScript;
    private final Duration ttl;
    private final Clock clock;

    public RedisSessionStore(StringRedisTemplate redisTemplate, AuthProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getTokens().getRefresh().getTtl();
        this.clock = clock;
        this.createScript = new DefaultRedisScript<>();
        this.createScript.setResultType(Long.class);
        this.createScript.setScriptText(CREATE_LUA);
        this.casScript = new DefaultRedisScript<>();
        this.casScript.setResultType(Long.class);
        this.casScript.setScriptText(CAS_LUA);
    }

    @Override
    public Session create(long userId, String hash) {
        Long id = redisTemplate.opsForValue().increment("auth:session:seq");
        if (id == null) {
            throw new IllegalStateException("Failed to allocate session id");
        }
        Instant createdAt = Instant.now(clock);
        redisTemplate.execute(createScript, List.of(key(id), userKey(userId)),
                String.valueOf(userId), hash, String.valueOf(createdAt.toEpochMilli()),
                String.valueOf(ttl.toMillis()), String.valueOf(id));
        return new Session(id, userId, hash, createdAt);
    }

    @Override
    public Optional<Session> findById(long sessionId) {
        HashOperations<String, String, String> ops = redisTemplate.opsForHash();
        Map<String, String> data = ops.entries(key(sessionId));
        if (data == null || data.isEmpty() || data.get(FIELD_HASH) == null || data.get(FIELD_USER_ID) == null) {
            return Optional.empty();
        }
        String createdAt = data.get(FIELD_CREATED_AT);
        return Optional.of(new Session(
                sessionId,
                Long.parseLong(data.get(FIELD_USER_ID)),
                data.get(FIELD_HASH),
                createdAt == null ? null : Instant.ofEpochMilli(Long.parseLong(createdAt))));
    }

    @Override
    public boolean compareAndSwapHash(long sessionId, String expectedHash, String newHash) {
        Long swapped = redisTemplate.execute(casScript, List.of(key(sessionId)),
                expectedHash, newHash, String.valueOf(ttl.toMillis()));
        if (swapped == null || swapped == 0L) {
            return false;
        }
        Session session = findById(sessionId).orElse(null);
        if (session != null) {
            redisTemplate.expire(userKey(session.userId()), ttl);
        }
        return true;
    }

    @Override
    public void deleteById(long sessionId) {
        String key = key(sessionId);
        HashOperations<String, String, String> ops = redisTemplate.opsForHash();
        String userId = ops.get(key, FIELD_USER_ID);
        redisTemplate.delete(key);
        if (userId != null) {
            redisTemplate.opsForSet().remove(userKey(Long.parseLong(userId)), String.valueOf(sessionId));
        }
    }

    @Override
    public void deleteByUserId(long userId) {
        String userKey = userKey(userId);
        Set<String> members = redisTemplate.opsForSet().members(userKey);
        List<String> keys = new ArrayList<>();
        if (members != null) {
            members.forEach(id -> keys.add(key(Long.parseLong(id))));
        }
        keys.add(userKey);
        redisTemplate.delete(keys);
    }

    @Override
    public void deleteByUserIdExcept(long userId, long keepSessionId) {
        String userKey = userKey(userId);
        Set<String> members = redisTemplate.opsForSet().members(userKey);
        if (members == null || members.isEmpty()) {
            return;
        }
        String keep = String.valueOf(keepSessionId);
        List<String> keys = new ArrayList<>();
        List<Object> removed = new ArrayList<>();
        for (String id : members) {
            if (!keep.equals(id)) {
                keys.add(key(Long.parseLong(id)));
                removed.add(id);
            }
        }
        if (!keys.isEmpty()) {
            redisTemplate.delete(keys);
            redisTemplate.opsForSet().remove(userKey, removed.toArray());
        }
    }

    private static String key(long sessionId) {
        return "auth:session:%d".formatted(sessionId);
    }

    private static String userKey(long userId) {
        return "auth:session:user:%d".formatted(userId);
    }
}
