package com.saddlery.role.mapper;

import com.saddlery.role.domain.Role;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface RoleMapper {

    List<Role> findAll();
}
