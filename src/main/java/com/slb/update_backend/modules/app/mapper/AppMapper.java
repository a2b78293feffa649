package com.slb.update_backend.modules.app.mapper;

import com.slb.update_backend.modules.app.entity.App;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface AppMapper {

    int insert(App app);

    Optional<App> selectById(@Param("id") Long id);

    Optional<App> findBySlug(@Param("slug") String slug);

    List<App> selectPage(@Param("offset") int offset, @Param("limit") int limit);

    long countAll();

    int update(App app);

    int deleteById(@Param("id") Long id);

    long countPublishedReleases(@Param("appId") Long appId);
}
