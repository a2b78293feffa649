package com.slb.update_backend.modules.app.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Schema(description = "接入更新服务的应用 / Application registered for updates")
public class App implements Serializable {

    private static final long serialVersionUID = 1L;

    @Schema(description = "主键 ID", example = "1")
    private Long id;

    @Schema(description = "应用 slug，出现在更新 URL 中", example = "acme")
    private String slug;

    @Schema(description = "应用名称", example = "Acme Desktop")
    private String name;

    @Schema(description = "应用描述")
    private String description;

    @Schema(description = "Tauri updater 公钥（配置后，没有签名的更新包不会下发）", nullable = true)
    private String publicKey;

    @Schema(description = "创建时间（UTC）")
    private LocalDateTime createdAt;

    @Schema(description = "更新时间（UTC）")
    private LocalDateTime updatedAt;
}
