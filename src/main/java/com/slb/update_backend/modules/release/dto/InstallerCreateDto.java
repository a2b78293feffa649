package com.slb.update_backend.modules.release.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "登记安装包 / Register an installer")
public class InstallerCreateDto {

    @NotBlank(message = "platform 不能为空")
    @Size(max = 50, message = "platform 最长 50 个字符")
    @Schema(description = "平台，允许 darwin-universal / windows-x86 / linux-armv7",
            example = "darwin-universal", requiredMode = Schema.RequiredMode.REQUIRED)
    private String platform;

    @NotBlank(message = "filename 不能为空")
    @Size(max = 255, message = "filename 最长 255 个字符")
    @Schema(description = "文件名", example = "Acme-1.2.0-universal.dmg", requiredMode = Schema.RequiredMode.REQUIRED)
    private String filename;

    @Size(max = 100, message = "displayName 最长 100 个字符")
    @Schema(description = "展示名称", example = "macOS (Universal)")
    private String displayName;

    @NotBlank(message = "downloadUrl 不能为空")
    @Size(max = 2048, message = "downloadUrl 最长 2048 个字符")
    @Schema(description = "安装包下载地址", requiredMode = Schema.RequiredMode.REQUIRED)
    private String downloadUrl;

    @PositiveOrZero(message = "fileSize 不能为负数")
    @Schema(description = "文件大小（字节）")
    private Long fileSize;

    @Size(max = 128, message = "checksum 最长 128 个字符")
    @Schema(description = "文件校验和")
    private String checksum;

    @Schema(description = "同平台已存在时是否覆盖", example = "false")
    private boolean replace;
}
