package com.slb.update_backend.modules.update.controller;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.util.VersionUtil;
import com.slb.update_backend.modules.analytics.service.CountryResolver;
import com.slb.update_backend.modules.analytics.service.DownloadRecorder;
import com.slb.update_backend.modules.update.model.InstallerMatch;
import com.slb.update_backend.modules.update.model.NoUpdateReason;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import com.slb.update_backend.modules.update.service.UpdateResolver;
import com.slb.update_backend.modules.update.vo.TauriUpdateResponseVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Optional;

/**
 * Tauri plugin-updater 动态服务器：返回裸 JSON，不包装 ApiResponse。
 *
 * <p>200 有更新；204 无更新或该平台没有可下发的更新包；404 应用不存在。</p>
 */
@RestController
@Tag(name = "客户端/更新", description = "为 @tauri-apps/plugin-updater 提供检查更新与安装包下载（无需认证）")
public class UpdateController {

    private static final int SLUG_MIN = 2;
    private static final int SLUG_MAX = 50;
    private static final int TARGET_MAX = 50;

    private final UpdateResolver updateResolver;
    private final DownloadRecorder downloadRecorder;

    public UpdateController(UpdateResolver updateResolver, DownloadRecorder downloadRecorder) {
        this.updateResolver = updateResolver;
        this.downloadRecorder = downloadRecorder;
    }

    @GetMapping("/{appSlug}/update/{target}/{currentVersion}")
    @Operation(
            summary = "检查更新",
            description = """
                    Tauri updater endpoint 配置示例：
                    https://updates.example.com/acme/update/{{target}}/{{current_version}}

                    - 200：{version, notes, pub_date, url, signature}
                    - 204：没有更新，或该平台（含回退平台）没有可下发的更新包
                    - 404：应用不存在
                    - 400：路径参数不合法
                    """
    )
    public ResponseEntity<TauriUpdateResponseVo> check(
            @Parameter(description = "应用 slug", example = "acme") @PathVariable String appSlug,
            @Parameter(description = "Tauri target，支持别名", example = "darwin-aarch64") @PathVariable String target,
            @Parameter(description = "客户端当前版本", example = "1.0.0") @PathVariable String currentVersion,
            HttpServletRequest request) {
        return respond(appSlug, target, currentVersion, request);
    }

    @GetMapping("/{appSlug}/update/{target}/{arch}/{currentVersion}")
    @Operation(
            summary = "检查更新（target 与 arch 分开）",
            description = "对应 Tauri endpoint 模板 /{{target}}/{{arch}}/{{current_version}}，服务端拼接为 target-arch。"
    )
    public ResponseEntity<TauriUpdateResponseVo> checkWithArch(
            @PathVariable String appSlug,
            @Parameter(description = "操作系统", example = "darwin") @PathVariable String target,
            @Parameter(description = "CPU 架构", example = "aarch64") @PathVariable String arch,
            @PathVariable String currentVersion,
            HttpServletRequest request) {
        return respond(appSlug, target + "-" + arch, currentVersion, request);
    }

    @GetMapping("/{appSlug}/download/{platform}")
    @Operation(
            summary = "下载最新安装包",
            description = "302 跳转到最新已发布版本中该平台（含回退平台）的安装包；应用或安装包不存在返回 404。"
    )
    public ResponseEntity<Void> download(
            @PathVariable String appSlug,
            @Parameter(description = "平台，支持别名", example = "darwin-universal") @PathVariable String platform,
            HttpServletRequest request) {
        validateSlug(appSlug);
        validateTarget(platform);
        Optional<InstallerMatch> match = updateResolver.resolveInstaller(appSlug, platform);
        if (match.isEmpty()) {
            throw new BizException(404, "No installer available for app '" + appSlug + "' on platform '" + platform + "'");
        }
        downloadRecorder.recordInstaller(match.get(), CountryResolver.resolve(request));
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(match.get().installer().getDownloadUrl()))
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .build();
    }

    private ResponseEntity<TauriUpdateResponseVo> respond(String appSlug, String target, String currentVersion,
                                                          HttpServletRequest request) {
        validateSlug(appSlug);
        validateTarget(target);
        if (!VersionUtil.isValid(currentVersion)) {
            throw new BizException(400, "current_version must be a semantic version, got '" + currentVersion + "'");
        }

        UpdateDecision decision = updateResolver.resolve(appSlug, target, currentVersion);
        if (decision instanceof UpdateDecision.UpdateAvailable update) {
            downloadRecorder.recordUpdate(update, CountryResolver.resolve(request));
            return ResponseEntity.ok(TauriUpdateResponseVo.from(update));
        }
        NoUpdateReason reason = ((UpdateDecision.NoUpdate) decision).reason();
        if (reason == NoUpdateReason.APP_NOT_FOUND) {
            throw BizException.notFound("App", appSlug);
        }
        return ResponseEntity.noContent().build();
    }

    private static void validateSlug(String appSlug) {
        if (appSlug == null || appSlug.length() < SLUG_MIN || appSlug.length() > SLUG_MAX) {
            throw new BizException(400, "app_slug must be between " + SLUG_MIN + " and " + SLUG_MAX + " characters");
        }
    }

    private static void validateTarget(String target) {
        if (target == null || target.isBlank() || target.length() > TARGET_MAX) {
            throw new BizException(400, "target must be between 1 and " + TARGET_MAX + " characters");
        }
    }
}
