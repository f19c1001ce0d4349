package com.saddlery.auth.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 异步审计写入。
 * <p>
 * 在独立的有界线程池 `auditExecutor` 上写入 audit_log：
 * - 队列满时丢弃事件并记录 WARN，不阻塞认证请求；
 * - 写入异常记录 WARN 后丢弃，不重试。
 */
@Slf4j
@Service
public class AsyncAuditSink implements AuditSink {

    private final AuditEventMapper auditEventMapper;
    private final TaskExecutor executor;
    private final Clock clock;

    public AsyncAuditSink(AuditEventMapper auditEventMapper,
                          @Qualifier("auditExecutor") TaskExecutor executor,
                          Clock clock) {
        this.auditEventMapper = auditEventMapper;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void record(AuditEvent event) {
        if (event.getCreatedAt() == null) {
            event.setCreatedAt(Instant.now(clock));
        }
        try {
            executor.execute(() -> write(event));
        } catch (TaskRejectedException ex) {
            log.warn("Audit event dropped, executor saturated action={} userId={}", event.getAction(), event.getUserId());
        }
    }

    private void write(AuditEvent event) {
        try {
            auditEventMapper.insert(event);
        } catch (RuntimeException ex) {
            log.warn("Audit event dropped, insert failed action={} userId={}: {}",
                    event.getAction(), event.getUserId(), ex.getMessage());
        }
    }
}
