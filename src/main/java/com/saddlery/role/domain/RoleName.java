package com.saddlery.role.domain;

/**
 * 已知角色及其兜底 ID。
 * <p>
 * 角色目录缺少对应记录时使用这里的 ID，保证授权不会仅因目录数据缺失而失败。
 * authority 为前端使用的权限名，factory 与 customsaddler 在前端均视为供应商。
 */
public enum RoleName {
    USER(1, "user", "ROLE_USER"),
    ADMIN(2, "admin", "ROLE_ADMIN"),
    FITTER(3, "fitter", "ROLE_FITTER"),
    FACTORY(4, "factory", "ROLE_SUPPLIER"),
    CUSTOMSADDLER(5, "customsaddler", "ROLE_SUPPLIER"),
    SUPERVISOR(6, "supervisor", "ROLE_SUPERVISOR");

    private final long fallbackId;
    private final String value;
    private final String authority;

    RoleName(long fallbackId, String value, String authority) {
        this.fallbackId = fallbackId;
        this.value = value;
        this.authority = authority;
    }

    public long fallbackId() {
        return fallbackId;
    }

    public String value() {
        return value;
    }

    public String authority() {
        return authority;
    }

    public Role fallbackRole() {
        return new Role(fallbackId, value);
    }

    /**
     * 按角色名查找，大小写不敏感，未知名称返回 USER。
     *
     * @param name 角色名。
     * @return 对应的角色枚举。
     */
    public static RoleName fromValue(String name) {
        if (name != null) {
            for (RoleName roleName : values()) {
                if (roleName.value.equalsIgnoreCase(name.trim())) {
                    return roleName;
                }
            }
        }
        return USER;
    }
}
