package com.slb.update_backend.modules.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "更新应用请求体（字段为 null 表示不修改）/ Update app request")
public class AppUpdateDto {

    @Size(min = 1, max = 100, message = "name 长度需在 1-100 之间")
    @Schema(description = "应用名称", example = "Acme Desktop")
    private String name;

    @Size(max = 1000, message = "description 最长 1000 个字符")
    @Schema(description = "应用描述")
    private String description;

    @Schema(description = "Tauri updater 公钥；传空串表示清除")
    private String publicKey;
}
