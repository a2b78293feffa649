package com.slb.update_backend.modules.release.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.service.ArtifactService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin/apps/{appId}/releases/{releaseId}/artifacts")
@Tag(name = "管理员/更新包", description = "每个版本每个平台一个 Tauri updater artifact")
public class AdminArtifactController {

    private final ArtifactService artifactService;
    private final AppAccessGuard appAccessGuard;

    public AdminArtifactController(ArtifactService artifactService, AppAccessGuard appAccessGuard) {
        this.artifactService = artifactService;
        this.appAccessGuard = appAccessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "登记更新包",
            description = """
                    平台会先归一化（macos-arm64 -> darwin-aarch64），且必须是 Tauri updater 支持的 6 个 target 之一。
                    已归档版本返回 409；同平台已存在时返回 409，除非 replace=true。
                    """
    )
    public ApiResponse<Artifact> create(@PathVariable Long appId, @PathVariable Long releaseId,
                                        @Valid @RequestBody ArtifactCreateDto dto) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(artifactService.create(appId, releaseId, dto));
    }

    @GetMapping
    @Operation(summary = "查询版本的更新包")
    public ApiResponse<List<Artifact>> list(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(artifactService.list(appId, releaseId));
    }

    @GetMapping("/{artifactId}")
    @Operation(summary = "查询单个更新包")
    public ApiResponse<Artifact> get(@PathVariable Long appId, @PathVariable Long releaseId,
                                     @PathVariable Long artifactId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(artifactService.get(appId, releaseId, artifactId));
    }

    @DeleteMapping("/{artifactId}")
    @Operation(summary = "删除更新包", description = "已归档版本的更新包不可删除（409）。")
    public ApiResponse<Void> delete(@PathVariable Long appId, @PathVariable Long releaseId,
                                    @PathVariable Long artifactId) {
        appAccessGuard.check(appId);
        artifactService.delete(appId, releaseId, artifactId);
        return ApiResponse.ok();
    }
}
