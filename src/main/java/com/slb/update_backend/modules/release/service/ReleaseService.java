package com.slb.update_backend.modules.release.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.util.VersionUtil;
import com.slb.update_backend.common.vo.PageVo;
import com.slb.update_backend.modules.app.mapper.AppMapper;
import com.slb.update_backend.modules.release.dto.ReleaseCreateDto;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.release.mapper.ArtifactMapper;
import com.slb.update_backend.modules.release.mapper.InstallerMapper;
import com.slb.update_backend.modules.release.mapper.ReleaseMapper;
import com.slb.update_backend.modules.release.vo.ReleaseDetailVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 版本生命周期：draft -> published -> archived。
 *
 * <p>状态迁移通过带 {@code WHERE status = expected} 的条件更新完成，并发迁移中落后的一方得到 409。</p>
 */
@Service
@Slf4j
public class ReleaseService {

    private final ReleaseMapper releaseMapper;
    private final ArtifactMapper artifactMapper;
    private final InstallerMapper installerMapper;
    private final AppMapper appMapper;
    private final Clock clock;

    public ReleaseService(ReleaseMapper releaseMapper,
                          ArtifactMapper artifactMapper,
                          InstallerMapper installerMapper,
                          AppMapper appMapper,
                          Clock clock) {
        this.releaseMapper = releaseMapper;
        this.artifactMapper = artifactMapper;
        this.installerMapper = installerMapper;
        this.appMapper = appMapper;
        this.clock = clock;
    }

    public Release create(Long appId, ReleaseCreateDto dto) {
        appMapper.selectById(appId).orElseThrow(() -> BizException.notFound("App", appId));

        String version = dto.getVersion() == null ? "" : dto.getVersion().trim();
        if (!VersionUtil.isValid(version)) {
            throw new BizException(400, "Invalid semantic version: '" + version + "'");
        }
        if (releaseMapper.findByAppIdAndVersion(appId, version).isPresent()) {
            throw BizException.conflict("Release " + version + " already exists for app " + appId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Release release = new Release();
        release.setAppId(appId);
        release.setVersion(version);
        release.setNotes(StringUtils.hasText(dto.getNotes()) ? dto.getNotes() : null);
        release.setStatus(ReleaseStatus.DRAFT);
        release.setCreatedAt(now);
        release.setUpdatedAt(now);
        try {
            releaseMapper.insert(release);
        } catch (DuplicateKeyException e) {
            throw BizException.conflict("Release " + version + " already exists for app " + appId);
        }
        log.info("Release created: appId={}, releaseId={}, version={}", appId, release.getId(), version);
        return release;
    }

    public Release get(Long appId, Long releaseId) {
        return releaseMapper.selectByIdAndAppId(releaseId, appId)
                .orElseThrow(() -> BizException.notFound("Release", releaseId));
    }

    public ReleaseDetailVo detail(Long appId, Long releaseId) {
        Release release = get(appId, releaseId);
        return new ReleaseDetailVo(release,
                artifactMapper.selectByReleaseId(releaseId),
                installerMapper.selectByReleaseId(releaseId));
    }

    public PageVo<Release> list(Long appId, @Nullable ReleaseStatus status, int page, int size) {
        appMapper.selectById(appId).orElseThrow(() -> BizException.notFound("App", appId));
        int p = Math.max(page, 1);
        int s = Math.min(Math.max(size, 1), 100);
        List<Release> releases = releaseMapper.selectPage(appId, status, PageVo.offset(p, s), s);
        return new PageVo<>(releaseMapper.count(appId, status), p, s, releases);
    }

    public Release updateNotes(Long appId, Long releaseId, @Nullable String notes) {
        Release release = get(appId, releaseId);
        if (release.getStatus() == ReleaseStatus.ARCHIVED) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String value = StringUtils.hasText(notes) ? notes : null;
        releaseMapper.updateNotes(releaseId, value, now);
        release.setNotes(value);
        release.setUpdatedAt(now);
        return release;
    }

    public Release publish(Long appId, Long releaseId) {
        Release release = get(appId, releaseId);
        if (!release.getStatus().canPublish()) {
            throw BizException.conflict("Release " + release.getVersion() + " is "
                    + release.getStatus().code() + "; only drafts can be published");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        transition(release, ReleaseStatus.PUBLISHED, now, now);
        release.setPubDate(now);
        log.info("Release published: appId={}, releaseId={}, version={}", appId, releaseId, release.getVersion());
        return release;
    }

    public Release archive(Long appId, Long releaseId) {
        Release release = get(appId, releaseId);
        if (!release.getStatus().canArchive()) {
            throw BizException.conflict("Release " + release.getVersion() + " is already archived");
        }
        transition(release, ReleaseStatus.ARCHIVED, null, LocalDateTime.now(clock));
        log.info("Release archived: appId={}, releaseId={}, version={}", appId, releaseId, release.getVersion());
        return release;
    }

    public void delete(Long appId, Long releaseId) {
        Release release = get(appId, releaseId);
        if (!release.getStatus().canDelete()) {
            throw BizException.conflict("Release " + release.getVersion() + " is "
                    + release.getStatus().code() + "; only drafts can be deleted");
        }
        if (releaseMapper.deleteDraft(releaseId) == 0) {
            throw BizException.conflict("Release " + release.getVersion() + " changed concurrently; reload and retry");
        }
        log.info("Release deleted: appId={}, releaseId={}, version={}", appId, releaseId, release.getVersion());
    }

    private void transition(Release release, ReleaseStatus target,
                            @Nullable LocalDateTime pubDate, LocalDateTime updatedAt) {
        ReleaseStatus expected = release.getStatus();
        int updated = releaseMapper.transition(release.getId(), expected, target, pubDate, updatedAt);
        if (updated == 0) {
            throw BizException.conflict("Release " + release.getVersion() + " changed concurrently; reload and retry");
        }
        release.setStatus(target);
        release.setUpdatedAt(updatedAt);
    }
}
