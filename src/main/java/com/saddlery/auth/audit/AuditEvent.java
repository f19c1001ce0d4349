package com.saddlery.auth.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    private Long id;
    /** 未能识别账号的登录失败为空。 */
    private Long userId;
    private AuditAction action;
    private boolean success;
    private String failureReason;
    private Long sessionId;
    private String identifier;
    private String ip;
    private String userAgent;
    private Instant createdAt;
}
