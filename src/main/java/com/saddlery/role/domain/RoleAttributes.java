package com.saddlery.role.domain;

import com.saddlery.user.domain.User;

/**
 * 角色推导所需的账号属性快照。
 *
 * @param rosterKey    查询 fitter 名册使用的 ID：优先旧系统 ID，否则为账号 ID。
 * @param userType     业务类型，可能为空。
 * @param isSupervisor 主管标记，可能为空。
 */
public record RoleAttributes(long rosterKey, Integer userType, Integer isSupervisor) {

    public static RoleAttributes of(User user) {
        long rosterKey = user.getLegacyId() != null ? user.getLegacyId() : user.getId();
        return new RoleAttributes(rosterKey, user.getUserType(), user.getIsSupervisor());
    }

    public boolean supervisor() {
        return isSupervisor != null && isSupervisor == 1;
    }
}
