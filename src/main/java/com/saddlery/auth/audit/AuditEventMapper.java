package com.saddlery.auth.audit;

import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AuditEventMapper {

    void insert(AuditEvent event);
}
