package com.slb.update_backend.modules.release.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Schema(description = "首次安装用的安装包（与 updater artifact 分开管理）")
public class Installer implements Serializable {

    private static final long serialVersionUID = 1L;

    @Schema(description = "主键 ID", example = "1")
    private Long id;

    @Schema(description = "所属版本 ID", example = "1")
    private Long releaseId;

    @Schema(description = "平台，允许 darwin-universal / windows-x86 / linux-armv7 等", example = "darwin-universal")
    private String platform;

    @Schema(description = "文件名", example = "Acme-1.2.0-universal.dmg")
    private String filename;

    @Schema(description = "展示名称", example = "macOS (Universal)")
    private String displayName;

    @Schema(description = "下载地址")
    private String downloadUrl;

    @Schema(description = "文件大小（字节）")
    private Long fileSize;

    @Schema(description = "文件校验和")
    private String checksum;

    @Schema(description = "创建时间（UTC）")
    private LocalDateTime createdAt;
}
