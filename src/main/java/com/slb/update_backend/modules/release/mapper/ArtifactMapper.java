package com.slb.update_backend.modules.release.mapper;

import com.slb.update_backend.modules.release.entity.Artifact;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface ArtifactMapper {

    int insert(Artifact artifact);

    List<Artifact> selectByReleaseId(@Param("releaseId") Long releaseId);

    Optional<Artifact> selectByIdAndReleaseId(@Param("id") Long id, @Param("releaseId") Long releaseId);

    Optional<Artifact> findByReleaseIdAndPlatform(@Param("releaseId") Long releaseId, @Param("platform") String platform);

    int deleteById(@Param("id") Long id);
}
