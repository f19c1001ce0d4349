package com.saddlery.user.mapper;

import com.saddlery.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface UserMapper {

    User findById(@Param("id") Long id);

    User findByEmail(@Param("email") String email);

    User findByEmailOrUsername(@Param("identifier") String identifier);

    boolean existsByEmail(@Param("email") String email);

    boolean existsByUsername(@Param("username") String username);

    void insert(User user);

    int updatePassword(@Param("id") Long id, @Param("passwordHash") String passwordHash, @Param("updatedAt") Instant updatedAt);

    int updateName(@Param("id") Long id, @Param("name") String name, @Param("updatedAt") Instant updatedAt);

    int enable(@Param("id") Long id, @Param("updatedAt") Instant updatedAt);

    int updateEmailAndEnable(@Param("id") Long id, @Param("email") String email, @Param("updatedAt") Instant updatedAt);

    int clearExpiredLock(@Param("id") Long id, @Param("now") Instant now);

    int registerFailedLogin(@Param("id") Long id,
                            @Param("maxAttempts") int maxAttempts,
                            @Param("lockUntil") Instant lockUntil);

    int registerSuccessfulLogin(@Param("id") Long id, @Param("now") Instant now);
}
