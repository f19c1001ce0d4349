package com.saddlery.role.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.saddlery.auth.config.AuthProperties;
import com.saddlery.role.domain.Role;
import com.saddlery.role.domain.RoleName;
import com.saddlery.role.mapper.RoleMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 角色目录。
 * <p>
 * 一次性读取 role 表并构建「角色名 → ID」映射，使用 Caffeine 缓存，过期时间取自
 * `auth.roles.catalog-ttl`。目录中没有对应记录时回退到 {@link RoleName} 的固定 ID。
 */
@Slf4j
@Service
public class RoleCatalog {

    private static final String ALL = "all";

    private final RoleMapper roleMapper;
    private final LoadingCache<String, Map<String, Long>> cache;

    public RoleCatalog(RoleMapper roleMapper, AuthProperties properties) {
        this.roleMapper = roleMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(properties.getRoles().getCatalogTtl())
                .build(key -> loadNameToId());
    }

    /**
     * 将角色名解析为 {id, name}。
     *
     * @param roleName 推导出的角色名。
     * @return 目录中的角色；缺失时为兜底角色。
     */
    public Role lookup(RoleName roleName) {
        Map<String, Long> nameToId;
        try {
            nameToId = cache.get(ALL);
        } catch (RuntimeException ex) {
            log.warn("Role catalog unavailable, using fallback id for {}: {}", roleName.value(), ex.getMessage());
            return roleName.fallbackRole();
        }
        Long id = nameToId.get(roleName.value());
        if (id == null) {
            log.debug("Role {} missing from catalog, using fallback id {}", roleName.value(), roleName.fallbackId());
            return roleName.fallbackRole();
        }
        return new Role(id, roleName.value());
    }

    private Map<String, Long> loadNameToId() {
        Map<String, Long> nameToId = new HashMap<>();
        for (Role role : roleMapper.findAll()) {
            if (role.name() != null) {
                nameToId.putIfAbsent(role.name().trim().toLowerCase(Locale.ROOT), role.id());
            }
        }
        log.debug("Loaded {} roles into catalog", nameToId.size());
        return Map.copyOf(nameToId);
    }
}
