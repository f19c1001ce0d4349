package com.saddlery.auth.service;

import com.saddlery.role.domain.Role;
import com.saddlery.role.domain.RoleAttributes;
import com.saddlery.role.domain.RoleName;
import com.saddlery.role.service.FitterRoster;
import com.saddlery.role.service.RoleCatalog;
import com.saddlery.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 角色推导服务。
 * <p>
 * 账号不存储角色，每次登录、刷新与查询当前用户时根据 userType、isSupervisor 与 fitter 名册重新推导。
 * 优先级（先命中先返回）：
 * 1. isSupervisor == 1 → supervisor，覆盖任何 userType；
 * 2. userType == 2 → admin；
 * 3. userType == 3 → factory；
 * 4. userType == 4 → customsaddler；
 * 5. userType == 1 且在名册中 → fitter；
 * 6. 以上均未命中但在名册中（旧账号未设置 userType）→ fitter；
 * 7. 其余 → user。
 */
@Service
@RequiredArgsConstructor
public class RoleResolver {

    private final RoleCatalog roleCatalog;
    private final FitterRoster fitterRoster;

    /**
     * 推导账号的有效角色。
     *
     * @param user 最新读取的账号。
     * @return 角色 {id, name}。
     */
    public Role resolve(User user) {
        RoleAttributes attributes = RoleAttributes.of(user);
        boolean fitterMember = fitterRoster.isMember(attributes.rosterKey());
        return roleCatalog.lookup(decide(attributes, fitterMember));
    }

    /**
     * 纯函数：相同输入总是得到相同角色。
     *
     * @param attributes   账号属性快照。
     * @param fitterMember 是否在 fitter 名册中。
     * @return 角色名。
     */
    public static RoleName decide(RoleAttributes attributes, boolean fitterMember) {
        if (attributes.supervisor()) {
            return RoleName.SUPERVISOR;
        }
        Integer userType = attributes.userType();
        if (userType != null) {
            switch (userType) {
                case 2:
                    return RoleName.ADMIN;
                case 3:
                    return RoleName.FACTORY;
                case 4:
                    return RoleName.CUSTOMSADDLER;
                case 1:
                    if (fitterMember) {
                        return RoleName.FITTER;
                    }
                    break;
                default:
                    break;
            }
        }
        // 旧账号可能没有 userType，名册是唯一依据
        return fitterMember ? RoleName.FITTER : RoleName.USER;
    }
}
