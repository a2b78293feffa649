package com.slb.update_backend.modules.release.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "登记更新包 / Register an updater artifact")
public class ArtifactCreateDto {

    @NotBlank(message = "platform 不能为空")
    @Size(max = 50, message = "platform 最长 50 个字符")
    @Schema(description = "平台，支持别名（如 macos-arm64 会归一化为 darwin-aarch64）",
            example = "darwin-aarch64", requiredMode = Schema.RequiredMode.REQUIRED)
    private String platform;

    @Schema(description = ".sig 文件内容；应用配置了公钥时必填才会下发")
    private String signature;

    @NotBlank(message = "downloadUrl 不能为空")
    @Size(max = 2048, message = "downloadUrl 最长 2048 个字符")
    @Schema(description = "更新包下载地址", requiredMode = Schema.RequiredMode.REQUIRED)
    private String downloadUrl;

    @PositiveOrZero(message = "fileSize 不能为负数")
    @Schema(description = "文件大小（字节）", example = "52428800")
    private Long fileSize;

    @Size(max = 128, message = "checksum 最长 128 个字符")
    @Schema(description = "文件校验和")
    private String checksum;

    @Schema(description = "同平台已存在时是否覆盖，默认 false（返回 409）", example = "false")
    private boolean replace;
}
