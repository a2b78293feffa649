package com.slb.update_backend.modules.release.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Schema(description = "更新包（Tauri updater artifact），每个版本每个平台一个")
public class Artifact implements Serializable {

    private static final long serialVersionUID = 1L;

    @Schema(description = "主键 ID", example = "1")
    private Long id;

    @Schema(description = "所属版本 ID", example = "1")
    private Long releaseId;

    @Schema(description = "平台 target", example = "darwin-aarch64")
    private String platform;

    @Schema(description = "签名：.sig 文件内容（只存储与下发，服务端不校验）")
    private String signature;

    @Schema(description = "更新包下载地址", example = "https://cdn.example.com/acme/1.2.0/acme.app.tar.gz")
    private String downloadUrl;

    @Schema(description = "文件大小（字节）", example = "52428800")
    private Long fileSize;

    @Schema(description = "文件校验和（如 sha256）")
    private String checksum;

    @Schema(description = "创建时间（UTC）")
    private LocalDateTime createdAt;
}
