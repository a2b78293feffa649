package com.slb.update_backend.modules.health.mapper;

import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface HealthMapper {

    int ping();
}
