package com.slb.update_backend.modules.release.mapper;

import com.slb.update_backend.modules.release.entity.Installer;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface InstallerMapper {

    int insert(Installer installer);

    List<Installer> selectByReleaseId(@Param("releaseId") Long releaseId);

    Optional<Installer> selectByIdAndReleaseId(@Param("id") Long id, @Param("releaseId") Long releaseId);

    Optional<Installer> findByReleaseIdAndPlatform(@Param("releaseId") Long releaseId, @Param("platform") String platform);

    int deleteById(@Param("id") Long id);
}
