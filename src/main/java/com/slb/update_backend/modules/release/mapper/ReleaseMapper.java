package com.slb.update_backend.modules.release.mapper;

import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.entity.ReleaseWithArtifacts;
import com.slb.update_backend.modules.release.entity.ReleaseWithInstallers;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface ReleaseMapper {

    int insert(Release release);

    Optional<Release> selectByIdAndAppId(@Param("id") Long id, @Param("appId") Long appId);

    Optional<Release> findByAppIdAndVersion(@Param("appId") Long appId, @Param("version") String version);

    List<Release> selectPage(@Param("appId") Long appId,
                             @Param("status") ReleaseStatus status,
                             @Param("offset") int offset,
                             @Param("limit") int limit);

    long count(@Param("appId") Long appId, @Param("status") ReleaseStatus status);

    int updateNotes(@Param("id") Long id, @Param("notes") String notes, @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 条件更新：只有当前状态等于 expected 时才会写入，返回受影响行数。
     * pubDate 为 null 时保持原值。
     */
    int transition(@Param("id") Long id,
                   @Param("expected") ReleaseStatus expected,
                   @Param("target") ReleaseStatus target,
                   @Param("pubDate") LocalDateTime pubDate,
                   @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 只删除草稿；artifacts / installers 由外键级联删除。
     */
    int deleteDraft(@Param("id") Long id);

    List<ReleaseWithArtifacts> findPublishedWithArtifacts(@Param("appId") Long appId);

    List<ReleaseWithInstallers> findPublishedWithInstallers(@Param("appId") Long appId);
}
