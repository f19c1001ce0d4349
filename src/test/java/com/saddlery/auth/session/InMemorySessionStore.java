package com.saddlery.auth.session;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存会话存储，hash 轮换语义与 Redis 实现一致（比较并交换）。
 */
public class InMemorySessionStore implements SessionStore {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<Long, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Session create(long userId, String hash) {
        Session session = new Session(sequence.incrementAndGet(), userId, hash, Instant.now());
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public Optional<Session> findById(long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean compareAndSwapHash(long sessionId, String expectedHash, String newHash) {
        Session current = sessions.get(sessionId);
        if (current == null || !current.hash().equals(expectedHash)) {
            return false;
        }
        Session next = new Session(current.id(), current.userId(), newHash, current.createdAt());
        return sessions.replace(sessionId, current, next);
    }

    @Override
    public void deleteById(long sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public void deleteByUserId(long userId) {
        sessions.values().removeIf(session -> session.userId() == userId);
    }

    @Override
    public void deleteByUserIdExcept(long userId, long keepSessionId) {
        sessions.values().removeIf(session -> session.userId() == userId && session.id() != keepSessionId);
    }

    public int size() {
        return sessions.size();
    }
}
