package com.slb.update_backend.modules.ci.dto;

import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "CI 一次性发布：创建版本、挂更新包、可选直接发布")
public class CiReleaseDto {

    @NotBlank(message = "version 不能为空")
    @Size(max = 50, message = "version 最长 50 个字符")
    @Schema(description = "SemVer 版本号", example = "1.2.0", requiredMode = Schema.RequiredMode.REQUIRED)
    private String version;

    @Size(max = 10000, message = "notes 最长 10000 个字符")
    @Schema(description = "更新说明")
    private String notes;

    @Valid
    @NotNull(message = "artifacts 不能为 null，没有更新包时传空数组")
    @Size(max = 20, message = "artifacts 最多 20 个")
    @Schema(description = "更新包列表，平台不可重复")
    private List<ArtifactCreateDto> artifacts = new ArrayList<>();

    @Schema(description = "是否直接发布，默认 false（保留为 draft）", example = "true")
    private boolean autoPublish;
}
