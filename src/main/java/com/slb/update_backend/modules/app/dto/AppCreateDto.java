package com.slb.update_backend.modules.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "创建应用请求体 / Create app request")
public class AppCreateDto {

    @NotBlank(message = "slug 不能为空")
    @Size(min = 2, max = 50, message = "slug 长度需在 2-50 之间")
    @Pattern(regexp = "^[a-z][a-z0-9-]*[a-z0-9]$",
            message = "slug 只能包含小写字母、数字和连字符，且以字母开头、字母或数字结尾")
    @Schema(description = "应用 slug", example = "acme", requiredMode = Schema.RequiredMode.REQUIRED)
    private String slug;

    @NotBlank(message = "name 不能为空")
    @Size(max = 100, message = "name 最长 100 个字符")
    @Schema(description = "应用名称", example = "Acme Desktop", requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    @Size(max = 1000, message = "description 最长 1000 个字符")
    @Schema(description = "应用描述")
    private String description;

    @Schema(description = "Tauri updater 公钥（可选）")
    private String publicKey;
}
