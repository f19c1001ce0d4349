package com.saddlery.role.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface FitterMapper {

    boolean existsByUserId(@Param("userId") long userId);
}
