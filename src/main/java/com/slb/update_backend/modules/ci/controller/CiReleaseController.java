package com.slb.update_backend.modules.ci.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.modules.ci.dto.CiReleaseDto;
import com.slb.update_backend.modules.ci.service.CiReleaseService;
import com.slb.update_backend.modules.ci.vo.CiReleaseVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/ci/apps/{appSlug}/releases")
@Tag(name = "CI/发布", description = "流水线一次性创建版本并挂更新包（需要 ci 或 admin scope）")
public class CiReleaseController {

    private final CiReleaseService ciReleaseService;

    public CiReleaseController(CiReleaseService ciReleaseService) {
        this.ciReleaseService = ciReleaseService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "CI 发布版本",
            description = """
                    在一个事务内创建版本、挂更新包，autoPublish=true 时直接发布。
                    请求内平台重复返回 400；版本已存在返回 409；绑定其它应用的 key 返回 403。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/ci/apps/acme/releases" \\
                      -H "Authorization: Bearer <ci-key>" \\
                      -H "Content-Type: application/json" \\
                      -d '{
                        "version": "1.2.0",
                        "notes": "修复若干已知问题",
                        "autoPublish": true,
                        "artifacts": [
                          {"platform": "darwin-aarch64", "downloadUrl": "https://cdn.example.com/acme_1.2.0_aarch64.app.tar.gz", "signature": "<sig>"}
                        ]
                      }'
                    """
    )
    public ApiResponse<CiReleaseVo> release(@PathVariable String appSlug, @Valid @RequestBody CiReleaseDto dto) {
        return ApiResponse.ok(ciReleaseService.release(appSlug, dto));
    }
}
