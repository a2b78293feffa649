package com.slb.update_backend.modules.release.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.common.vo.PageVo;
import com.slb.update_backend.modules.release.dto.ReleaseCreateDto;
import com.slb.update_backend.modules.release.dto.ReleaseNotesUpdateDto;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.release.service.ReleaseService;
import com.slb.update_backend.modules.release.vo.ReleaseDetailVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/apps/{appId}/releases")
@Tag(name = "管理员/版本", description = "版本生命周期：draft -> published -> archived")
public class AdminReleaseController {

    private final ReleaseService releaseService;
    private final AppAccessGuard appAccessGuard;

    public AdminReleaseController(ReleaseService releaseService, AppAccessGuard appAccessGuard) {
        this.releaseService = releaseService;
        this.appAccessGuard = appAccessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "创建版本（draft）",
            description = """
                    版本号必须是合法 SemVer；同一应用下版本号唯一，重复返回 409。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/admin/apps/1/releases" \\
                      -H "Authorization: Bearer <admin-key>" \\
                      -H "Content-Type: application/json" \\
                      -d '{"version": "1.2.0", "notes": "修复若干已知问题"}'
                    """
    )
    public ApiResponse<Release> create(@PathVariable Long appId, @Valid @RequestBody ReleaseCreateDto dto) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(releaseService.create(appId, dto));
    }

    @GetMapping
    @Operation(summary = "分页查询版本")
    public ApiResponse<PageVo<Release>> list(
            @PathVariable Long appId,
            @Parameter(description = "状态过滤：draft/published/archived（可选）", example = "published")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int size) {
        appAccessGuard.check(appId);
        ReleaseStatus filter = parseStatus(status);
        return ApiResponse.ok(releaseService.list(appId, filter, page, size));
    }

    @GetMapping("/{releaseId}")
    @Operation(summary = "版本详情（含更新包、安装包）")
    public ApiResponse<ReleaseDetailVo> get(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(releaseService.detail(appId, releaseId));
    }

    @PatchMapping("/{releaseId}")
    @Operation(summary = "修改更新说明", description = "已归档版本返回 409。")
    public ApiResponse<Release> updateNotes(@PathVariable Long appId, @PathVariable Long releaseId,
                                            @Valid @RequestBody ReleaseNotesUpdateDto dto) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(releaseService.updateNotes(appId, releaseId, dto.getNotes()));
    }

    @PostMapping("/{releaseId}/publish")
    @Operation(summary = "发布版本", description = "仅 draft 可发布，发布时写入 pub_date；其它状态返回 409。")
    public ApiResponse<Release> publish(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(releaseService.publish(appId, releaseId));
    }

    @PostMapping("/{releaseId}/archive")
    @Operation(summary = "归档版本", description = "draft 或 published 可归档；已归档返回 409。")
    public ApiResponse<Release> archive(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(releaseService.archive(appId, releaseId));
    }

    @DeleteMapping("/{releaseId}")
    @Operation(summary = "删除版本", description = "仅 draft 可删除，更新包与安装包级联删除。")
    public ApiResponse<Void> delete(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        releaseService.delete(appId, releaseId);
        return ApiResponse.ok();
    }

    private static ReleaseStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ReleaseStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            throw new BizException(400,
                    "status 只能是 draft / published / archived");
        }
    }
}
