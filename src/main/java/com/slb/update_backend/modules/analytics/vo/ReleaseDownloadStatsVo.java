package com.slb.update_backend.modules.analytics.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@Schema(description = "单个版本的下载统计")
public class ReleaseDownloadStatsVo {

    private Long releaseId;

    private String version;

    private long updateDownloads;

    private long installerDownloads;

    private long totalDownloads;

    private List<CountVo> byPlatform;
}
