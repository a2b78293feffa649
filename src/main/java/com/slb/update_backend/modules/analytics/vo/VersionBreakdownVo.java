package com.slb.update_backend.modules.analytics.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "单个版本的下载拆分")
public class VersionBreakdownVo {

    @Schema(description = "版本号", example = "1.2.0")
    private String version;

    @Schema(description = "版本 ID（版本已删除时为 null）", nullable = true)
    private Long releaseId;

    private long updateDownloads;

    private long installerDownloads;

    private long totalDownloads;
}
