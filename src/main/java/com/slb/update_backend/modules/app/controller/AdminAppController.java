package com.slb.update_backend.modules.app.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.common.vo.PageVo;
import com.slb.update_backend.modules.app.dto.AppCreateDto;
import com.slb.update_backend.modules.app.dto.AppUpdateDto;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.service.AppService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/apps")
@Tag(name = "管理员/应用", description = "应用注册与维护（slug、名称、Tauri 公钥）")
public class AdminAppController {

    private final AppService appService;
    private final AppAccessGuard appAccessGuard;

    public AdminAppController(AppService appService, AppAccessGuard appAccessGuard) {
        this.appService = appService;
        this.appAccessGuard = appAccessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "创建应用",
            description = """
                    slug 规则：2-50 个字符，小写字母开头，仅含小写字母、数字和单个连字符。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/admin/apps" \\
                      -H "Authorization: Bearer <admin-key>" \\
                      -H "Content-Type: application/json" \\
                      -d '{"slug": "acme", "name": "Acme Desktop"}'
                    """
    )
    public ApiResponse<App> create(@Valid @RequestBody AppCreateDto dto) {
        return ApiResponse.ok(appService.create(dto));
    }

    @GetMapping
    @Operation(summary = "分页查询应用")
    public ApiResponse<PageVo<App>> list(
            @Parameter(description = "页码，从 1 开始", example = "1")
            @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页条数，最大 100", example = "20")
            @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(appService.list(page, size));
    }

    @GetMapping("/{appId}")
    @Operation(summary = "查询应用详情")
    public ApiResponse<App> get(@PathVariable Long appId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(appService.get(appId));
    }

    @PatchMapping("/{appId}")
    @Operation(summary = "更新应用（名称、描述、公钥）", description = "字段为 null 表示不修改；公钥传空字符串表示清除。")
    public ApiResponse<App> update(@PathVariable Long appId, @Valid @RequestBody AppUpdateDto dto) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(appService.update(appId, dto));
    }

    @DeleteMapping("/{appId}")
    @Operation(summary = "删除应用", description = "存在已发布版本时返回 409，需先归档。")
    public ApiResponse<Void> delete(@PathVariable Long appId) {
        appAccessGuard.check(appId);
        appService.delete(appId);
        return ApiResponse.ok();
    }
}
