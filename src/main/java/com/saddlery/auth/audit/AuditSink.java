package com.saddlery.auth.audit;

/**
 * 认证审计出口。
 * <p>
 * 尽力而为、至多一次：调用方不等待写入完成，写入失败不影响认证结果。
 */
public interface AuditSink {

    /**
     * 提交一条审计事件。
     *
     * @param event 审计事件。
     */
    void record(AuditEvent event);
}
