package com.slb.update_backend.modules.analytics.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@Schema(description = "应用下载汇总（更新与安装包分开统计）")
public class DownloadSummaryVo {

    private Long appId;

    @Schema(description = "更新包下载总数")
    private long totalUpdateDownloads;

    @Schema(description = "安装包下载总数")
    private long totalInstallerDownloads;

    private long totalDownloads;

    @Schema(description = "按版本拆分，总数倒序")
    private List<VersionBreakdownVo> byVersion;

    @Schema(description = "按平台统计")
    private List<CountVo> byPlatform;
}
