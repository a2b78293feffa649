package com.slb.update_backend.modules.update.service;

import com.slb.update_backend.common.util.PlatformUtil;
import com.slb.update_backend.common.util.VersionUtil;
import com.slb.update_backend.config.UpdateProperties;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.ReleaseWithArtifacts;
import com.slb.update_backend.modules.release.entity.ReleaseWithInstallers;
import com.slb.update_backend.modules.update.model.InstallerMatch;
import com.slb.update_backend.modules.update.model.NoUpdateReason;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 检查更新的核心逻辑，无状态。
 *
 * <ol>
 *   <li>按 slug 查应用，不存在为 APP_NOT_FOUND；</li>
 *   <li>归一化 target，按 SemVer 从新到旧遍历已发布版本（无法解析的版本排最后）；</li>
 *   <li>第一个在“精确平台 + 回退链”上有可下发产物的版本即候选，没有则 NO_ARTIFACT_FOR_PLATFORM；</li>
 *   <li>候选不比当前版本新（或当前版本无法解析）为 NO_UPDATE_AVAILABLE。</li>
 * </ol>
 *
 * <p>注意：只看“最新的可下发版本”，不会因为它不比当前新而继续往旧版本找。</p>
 */
@Service
@Slf4j
public class UpdateResolver {

    private static final Comparator<ReleaseWithArtifacts> ARTIFACT_RELEASES_NEWEST_FIRST =
            Comparator.comparing(r -> r.getRelease().getVersion(), VersionUtil.NEWEST_FIRST);

    private static final Comparator<ReleaseWithInstallers> INSTALLER_RELEASES_NEWEST_FIRST =
            Comparator.comparing(r -> r.getRelease().getVersion(), VersionUtil.NEWEST_FIRST);

    private final ReleaseCatalog releaseCatalog;
    private final UpdateProperties updateProperties;

    public UpdateResolver(ReleaseCatalog releaseCatalog, UpdateProperties updateProperties) {
        this.releaseCatalog = releaseCatalog;
        this.updateProperties = updateProperties;
    }

    public UpdateDecision resolve(String appSlug, String rawTarget, String rawCurrentVersion) {
        Optional<App> app = releaseCatalog.findAppBySlug(appSlug);
        if (app.isEmpty()) {
            log.debug("Update check for unknown app: slug={}", appSlug);
            return UpdateDecision.none(NoUpdateReason.APP_NOT_FOUND);
        }

        String platform = PlatformUtil.normalize(rawTarget);
        List<String> order = PlatformUtil.resolutionOrder(platform);
        List<ReleaseWithArtifacts> releases = releaseCatalog.findPublishedWithArtifacts(app.get().getId())
                .stream()
                .sorted(ARTIFACT_RELEASES_NEWEST_FIRST)
                .toList();

        for (ReleaseWithArtifacts candidate : releases) {
            Optional<Artifact> artifact = pickArtifact(app.get(), candidate.getArtifacts(), order);
            if (artifact.isEmpty()) {
                continue;
            }
            String candidateVersion = candidate.getRelease().getVersion();
            if (!VersionUtil.isNewer(rawCurrentVersion, candidateVersion)) {
                log.debug("No update: slug={}, platform={}, current={}, latest={}",
                        appSlug, platform, rawCurrentVersion, candidateVersion);
                return UpdateDecision.none(NoUpdateReason.NO_UPDATE_AVAILABLE);
            }
            log.debug("Update available: slug={}, platform={}, current={}, target={}, via={}",
                    appSlug, platform, rawCurrentVersion, candidateVersion, artifact.get().getPlatform());
            return new UpdateDecision.UpdateAvailable(app.get(), candidate.getRelease(), artifact.get(), platform);
        }

        log.debug("No artifact: slug={}, platform={}, order={}", appSlug, platform, order);
        return UpdateDecision.none(NoUpdateReason.NO_ARTIFACT_FOR_PLATFORM);
    }

    /**
     * 最新的已发布版本中，按回退链能匹配到的安装包。
     */
    public Optional<InstallerMatch> resolveInstaller(String appSlug, String rawPlatform) {
        Optional<App> app = releaseCatalog.findAppBySlug(appSlug);
        if (app.isEmpty()) {
            return Optional.empty();
        }
        List<String> order = PlatformUtil.resolutionOrder(PlatformUtil.normalize(rawPlatform));
        List<ReleaseWithInstallers> releases = releaseCatalog.findPublishedWithInstallers(app.get().getId())
                .stream()
                .sorted(INSTALLER_RELEASES_NEWEST_FIRST)
                .toList();
        for (ReleaseWithInstallers candidate : releases) {
            for (String platform : order) {
                for (Installer installer : candidate.getInstallers()) {
                    if (platform.equals(installer.getPlatform()) && StringUtils.hasText(installer.getDownloadUrl())) {
                        return Optional.of(new InstallerMatch(app.get(), candidate.getRelease(), installer));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Artifact> pickArtifact(App app, List<Artifact> artifacts, List<String> order) {
        for (String platform : order) {
            for (Artifact artifact : artifacts) {
                if (platform.equals(artifact.getPlatform()) && isResolvable(app, artifact)) {
                    return Optional.of(artifact);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 没有下载地址的产物不可下发；应用配置了公钥时，缺签名的产物客户端会拒绝，也视为不可下发。
     */
    boolean isResolvable(App app, Artifact artifact) {
        if (!StringUtils.hasText(artifact.getDownloadUrl())) {
            return false;
        }
        if (updateProperties.isRequireSignatureWhenPublicKey() && StringUtils.hasText(app.getPublicKey())) {
            return StringUtils.hasText(artifact.getSignature());
        }
        return true;
    }
}
