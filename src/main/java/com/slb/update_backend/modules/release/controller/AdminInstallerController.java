package com.slb.update_backend.modules.release.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.modules.release.dto.InstallerCreateDto;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.service.InstallerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin/apps/{appId}/releases/{releaseId}/installers")
@Tag(name = "管理员/安装包", description = "首次安装用的安装包，供 /{app_slug}/download/{platform} 跳转")
public class AdminInstallerController {

    private final InstallerService installerService;
    private final AppAccessGuard appAccessGuard;

    public AdminInstallerController(InstallerService installerService, AppAccessGuard appAccessGuard) {
        this.installerService = installerService;
        this.appAccessGuard = appAccessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "登记安装包",
            description = """
                    平台会先归一化，除 6 个 updater target 外还允许 darwin-universal / windows-x86 / linux-armv7。
                    已归档版本返回 409；同平台已存在时返回 409，除非 replace=true。
                    """
    )
    public ApiResponse<Installer> create(@PathVariable Long appId, @PathVariable Long releaseId,
                                        @Valid @RequestBody InstallerCreateDto dto) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(installerService.create(appId, releaseId, dto));
    }

    @GetMapping
    @Operation(summary = "查询版本的安装包")
    public ApiResponse<List<Installer>> list(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(installerService.list(appId, releaseId));
    }

    @GetMapping("/{installerId}")
    @Operation(summary = "查询单个安装包")
    public ApiResponse<Installer> get(@PathVariable Long appId, @PathVariable Long releaseId,
                                     @PathVariable Long installerId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(installerService.get(appId, releaseId, installerId));
    }

    @DeleteMapping("/{installerId}")
    @Operation(summary = "删除安装包", description = "已归档版本的安装包不可删除（409）。")
    public ApiResponse<Void> delete(@PathVariable Long appId, @PathVariable Long releaseId,
                                    @PathVariable Long installerId) {
        appAccessGuard.check(appId);
        installerService.delete(appId, releaseId, installerId);
        return ApiResponse.ok();
    }
}
