package com.slb.update_backend.modules.release.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.util.PlatformUtil;
import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.mapper.ArtifactMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class ArtifactService {

    private final ArtifactMapper artifactMapper;
    private final ReleaseService releaseService;
    private final Clock clock;

    public ArtifactService(ArtifactMapper artifactMapper, ReleaseService releaseService, Clock clock) {
        this.artifactMapper = artifactMapper;
        this.releaseService = releaseService;
        this.clock = clock;
    }

    @Transactional
    public Artifact create(Long appId, Long releaseId, ArtifactCreateDto dto) {
        return attach(releaseService.get(appId, releaseId), dto);
    }

    /**
     * 给已加载的版本挂更新包；CI 发布流程在同一事务内复用。
     * replace 时先删后插，插入失败整体回滚，旧包不会丢。
     */
    @Transactional
    public Artifact attach(Release release, ArtifactCreateDto dto) {
        if (!release.getStatus().acceptsArtifacts()) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived and no longer accepts artifacts");
        }
        String platform = PlatformUtil.normalize(dto.getPlatform());
        if (!PlatformUtil.isArtifactPlatform(platform)) {
            throw new BizException(400, "Unsupported artifact platform '" + dto.getPlatform()
                    + "', expected one of " + PlatformUtil.ARTIFACT_PLATFORMS.stream().sorted().toList());
        }

        Optional<Artifact> existing = artifactMapper.findByReleaseIdAndPlatform(release.getId(), platform);
        if (existing.isPresent()) {
            if (!dto.isReplace()) {
                throw BizException.conflict("Release " + release.getVersion() + " already has an artifact for " + platform);
            }
            artifactMapper.deleteById(existing.get().getId());
            log.info("Artifact replaced: releaseId={}, platform={}", release.getId(), platform);
        }

        Artifact artifact = new Artifact();
        artifact.setReleaseId(release.getId());
        artifact.setPlatform(platform);
        artifact.setSignature(StringUtils.hasText(dto.getSignature()) ? dto.getSignature().trim() : null);
        artifact.setDownloadUrl(dto.getDownloadUrl().trim());
        artifact.setFileSize(dto.getFileSize());
        artifact.setChecksum(StringUtils.hasText(dto.getChecksum()) ? dto.getChecksum().trim() : null);
        artifact.setCreatedAt(LocalDateTime.now(clock));
        int inserted;
        try {
            inserted = artifactMapper.insert(artifact);
        } catch (DuplicateKeyException e) {
            throw BizException.conflict("Release " + release.getVersion() + " already has an artifact for " + platform);
        }
        if (inserted == 0) {
            // 读取状态之后版本被并发归档
            throw BizException.conflict("Release " + release.getVersion() + " is archived and no longer accepts artifacts");
        }
        return artifact;
    }

    public List<Artifact> list(Long appId, Long releaseId) {
        releaseService.get(appId, releaseId);
        return artifactMapper.selectByReleaseId(releaseId);
    }

    public Artifact get(Long appId, Long releaseId, Long artifactId) {
        releaseService.get(appId, releaseId);
        return artifactMapper.selectByIdAndReleaseId(artifactId, releaseId)
                .orElseThrow(() -> BizException.notFound("Artifact", artifactId));
    }

    public void delete(Long appId, Long releaseId, Long artifactId) {
        Release release = releaseService.get(appId, releaseId);
        if (!release.getStatus().acceptsArtifacts()) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived; its artifacts are frozen");
        }
        Artifact artifact = artifactMapper.selectByIdAndReleaseId(artifactId, releaseId)
                .orElseThrow(() -> BizException.notFound("Artifact", artifactId));
        artifactMapper.deleteById(artifact.getId());
        log.info("Artifact deleted: releaseId={}, platform={}", releaseId, artifact.getPlatform());
    }
}
