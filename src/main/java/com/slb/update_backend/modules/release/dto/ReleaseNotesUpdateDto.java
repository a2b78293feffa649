package com.slb.update_backend.modules.release.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "修改更新说明 / Update release notes")
public class ReleaseNotesUpdateDto {

    @Size(max = 10000, message = "notes 最长 10000 个字符")
    @Schema(description = "更新说明（Markdown），null 或空字符串表示清除")
    private String notes;
}
