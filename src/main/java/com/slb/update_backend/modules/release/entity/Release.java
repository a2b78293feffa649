package com.slb.update_backend.modules.release.entity;

import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Schema(description = "应用版本 / Release of an app")
public class Release implements Serializable {

    private static final long serialVersionUID = 1L;

    @Schema(description = "主键 ID", example = "1")
    private Long id;

    @Schema(description = "所属应用 ID", example = "1")
    private Long appId;

    @Schema(description = "版本号（SemVer）", example = "1.2.0")
    private String version;

    @Schema(description = "更新说明（Markdown）")
    private String notes;

    @Schema(description = "发布时间（UTC），仅在 draft -> published 时写入一次", nullable = true)
    private LocalDateTime pubDate;

    @Schema(description = "状态：draft/published/archived", example = "draft")
    private ReleaseStatus status;

    @Schema(description = "创建时间（UTC）")
    private LocalDateTime createdAt;

    @Schema(description = "更新时间（UTC）")
    private LocalDateTime updatedAt;
}
