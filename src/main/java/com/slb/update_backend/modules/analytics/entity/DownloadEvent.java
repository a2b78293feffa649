package com.slb.update_backend.modules.analytics.entity;

import com.slb.update_backend.modules.analytics.enums.DownloadType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 下载事件，只追加不修改。
 */
@Data
@Schema(description = "下载事件 / Download event")
public class DownloadEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    @Schema(description = "更新包 ID（update 类型）", nullable = true)
    private Long artifactId;

    @Schema(description = "安装包 ID（installer 类型）", nullable = true)
    private Long installerId;

    private Long appId;

    @Schema(description = "实际下发的平台", example = "darwin-aarch64")
    private String platform;

    @Schema(description = "下发的版本号", example = "1.2.0")
    private String version;

    @Schema(description = "ISO 国家代码（来自 CDN 请求头）", example = "CN", nullable = true)
    private String ipCountry;

    private DownloadType downloadType;

    @Schema(description = "下载时间（UTC）")
    private LocalDateTime downloadedAt;
}
