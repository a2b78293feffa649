package com.slb.update_backend.modules.ci.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.common.util.PlatformUtil;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.service.AppService;
import com.slb.update_backend.modules.ci.dto.CiReleaseDto;
import com.slb.update_backend.modules.ci.vo.CiReleaseVo;
import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import com.slb.update_backend.modules.release.dto.ReleaseCreateDto;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.service.ArtifactService;
import com.slb.update_backend.modules.release.service.ReleaseService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CI 流水线的一次性发布：任何一步失败整体回滚，不会留下半成品草稿。
 */
@Service
@Slf4j
public class CiReleaseService {

    private final AppService appService;
    private final ReleaseService releaseService;
    private final ArtifactService artifactService;
    private final AppAccessGuard appAccessGuard;

    public CiReleaseService(AppService appService,
                            ReleaseService releaseService,
                            ArtifactService artifactService,
                            AppAccessGuard appAccessGuard) {
        this.appService = appService;
        this.releaseService = releaseService;
        this.artifactService = artifactService;
        this.appAccessGuard = appAccessGuard;
    }

    @Transactional
    public CiReleaseVo release(String appSlug, CiReleaseDto dto) {
        App app = appService.getBySlug(appSlug);
        appAccessGuard.check(app.getId());
        rejectDuplicatePlatforms(dto.getArtifacts());

        ReleaseCreateDto create = new ReleaseCreateDto();
        create.setVersion(dto.getVersion());
        create.setNotes(dto.getNotes());
        Release release = releaseService.create(app.getId(), create);

        List<Artifact> artifacts = new ArrayList<>();
        for (ArtifactCreateDto artifact : dto.getArtifacts()) {
            artifacts.add(artifactService.attach(release, artifact));
        }

        if (dto.isAutoPublish()) {
            release = releaseService.publish(app.getId(), release.getId());
        }
        log.info("CI release: app={}, version={}, artifacts={}, published={}",
                appSlug, release.getVersion(), artifacts.size(), dto.isAutoPublish());
        return new CiReleaseVo(release, artifacts);
    }

    private static void rejectDuplicatePlatforms(List<ArtifactCreateDto> artifacts) {
        Set<String> seen = new HashSet<>();
        for (ArtifactCreateDto artifact : artifacts) {
            String platform = PlatformUtil.normalize(artifact.getPlatform());
            if (!seen.add(platform)) {
                throw new BizException(400, "Duplicate artifact platform in request: " + platform);
            }
        }
    }
}
