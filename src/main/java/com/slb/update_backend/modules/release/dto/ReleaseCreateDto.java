package com.slb.update_backend.modules.release.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "创建版本请求体（创建后为 draft）/ Create release request")
public class ReleaseCreateDto {

    @NotBlank(message = "version 不能为空")
    @Size(max = 50, message = "version 最长 50 个字符")
    @Schema(description = "SemVer 版本号", example = "1.2.0", requiredMode = Schema.RequiredMode.REQUIRED)
    private String version;

    @Size(max = 10000, message = "notes 最长 10000 个字符")
    @Schema(description = "更新说明（Markdown）", example = "修复若干已知问题")
    private String notes;
}
