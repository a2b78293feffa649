package com.slb.update_backend.modules.apikey.mapper;

import com.slb.update_backend.modules.apikey.entity.ApiKey;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface ApiKeyMapper {

    /**
     * 只返回未吊销的 key。
     */
    Optional<ApiKey> findActiveByKeyHash(@Param("keyHash") String keyHash);
}
