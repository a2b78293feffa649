package com.slb.update_backend.modules.analytics.mapper;

import com.slb.update_backend.modules.analytics.entity.DownloadEvent;
import com.slb.update_backend.modules.analytics.model.CountRow;
import com.slb.update_backend.modules.analytics.model.VersionTypeCountRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface DownloadEventMapper {

    int insert(DownloadEvent event);

    long countByApp(@Param("appId") Long appId,
                    @Param("start") LocalDateTime start,
                    @Param("end") LocalDateTime end);

    List<CountRow> countByVersion(@Param("appId") Long appId,
                                  @Param("start") LocalDateTime start,
                                  @Param("end") LocalDateTime end);

    List<CountRow> countByPlatform(@Param("appId") Long appId,
                                   @Param("start") LocalDateTime start,
                                   @Param("end") LocalDateTime end);

    /**
     * key 为 null 表示未知国家。
     */
    List<CountRow> countByCountry(@Param("appId") Long appId,
                                  @Param("start") LocalDateTime start,
                                  @Param("end") LocalDateTime end);

    /**
     * 按时间桶计数，key 格式为 "yyyy-MM-dd HH:00:00"（hourly）或 "yyyy-MM-dd 00:00:00"（daily）。
     */
    List<CountRow> countByBucket(@Param("appId") Long appId,
                                 @Param("start") LocalDateTime start,
                                 @Param("hourly") boolean hourly);

    /**
     * key 为 download_type（UPDATE / INSTALLER）。
     */
    List<CountRow> countByType(@Param("appId") Long appId, @Param("version") String version);

    List<VersionTypeCountRow> countByVersionAndType(@Param("appId") Long appId);

    List<CountRow> countByPlatformForVersion(@Param("appId") Long appId, @Param("version") String version);
}
