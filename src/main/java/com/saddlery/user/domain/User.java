package com.saddlery.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    private Long id;
    private String username;
    private String email;
    @ToString.Exclude
    private String passwordHash;
    private String name;
    private Boolean enabled;
    private Instant lockedUntil;
    private Integer failedLoginAttempts;
    private String provider;
    /** 业务类型：1 fitter，2 admin，3 factory，4 customsaddler；旧账号可能为空。 */
    private Integer userType;
    /** 主管标记：1 为主管，0 或空为否。 */
    private Integer isSupervisor;
    /** 旧系统中的用户 ID，用于关联 fitter 名册。 */
    private Long legacyId;
    private Instant lastLogin;
    private Instant createdAt;
    private Instant updatedAt;
}
