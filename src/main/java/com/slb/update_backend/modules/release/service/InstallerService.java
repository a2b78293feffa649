package com.slb.update_backend.modules.release.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.util.PlatformUtil;
import com.slb.update_backend.modules.release.dto.InstallerCreateDto;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.mapper.InstallerMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 安装包与更新包规则相同，只是平台集合更大。
 */
@Service
@Slf4j
public class InstallerService {

    private final InstallerMapper installerMapper;
    private final ReleaseService releaseService;
    private final Clock clock;

    public InstallerService(InstallerMapper installerMapper, ReleaseService releaseService, Clock clock) {
        this.installerMapper = installerMapper;
        this.releaseService = releaseService;
        this.clock = clock;
    }

    @Transactional
    public Installer create(Long appId, Long releaseId, InstallerCreateDto dto) {
        Release release = releaseService.get(appId, releaseId);
        if (!release.getStatus().acceptsArtifacts()) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived and no longer accepts installers");
        }
        String platform = PlatformUtil.normalize(dto.getPlatform());
        if (!PlatformUtil.isInstallerPlatform(platform)) {
            throw new BizException(400, "Unsupported installer platform '" + dto.getPlatform()
                    + "', expected one of " + PlatformUtil.INSTALLER_PLATFORMS.stream().sorted().toList());
        }

        Optional<Installer> existing = installerMapper.findByReleaseIdAndPlatform(releaseId, platform);
        if (existing.isPresent()) {
            if (!dto.isReplace()) {
                throw BizException.conflict("Release " + release.getVersion() + " already has an installer for " + platform);
            }
            installerMapper.deleteById(existing.get().getId());
        }

        Installer installer = new Installer();
        installer.setReleaseId(releaseId);
        installer.setPlatform(platform);
        installer.setFilename(dto.getFilename().trim());
        installer.setDisplayName(StringUtils.hasText(dto.getDisplayName()) ? dto.getDisplayName().trim() : null);
        installer.setDownloadUrl(dto.getDownloadUrl().trim());
        installer.setFileSize(dto.getFileSize());
        installer.setChecksum(StringUtils.hasText(dto.getChecksum()) ? dto.getChecksum().trim() : null);
        installer.setCreatedAt(LocalDateTime.now(clock));
        int inserted;
        try {
            inserted = installerMapper.insert(installer);
        } catch (DuplicateKeyException e) {
            throw BizException.conflict("Release " + release.getVersion() + " already has an installer for " + platform);
        }
        if (inserted == 0) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived and no longer accepts installers");
        }
        log.info("Installer registered: releaseId={}, platform={}, filename={}", releaseId, platform, installer.getFilename());
        return installer;
    }

    public List<Installer> list(Long appId, Long releaseId) {
        releaseService.get(appId, releaseId);
        return installerMapper.selectByReleaseId(releaseId);
    }

    public Installer get(Long appId, Long releaseId, Long installerId) {
        releaseService.get(appId, releaseId);
        return installerMapper.selectByIdAndReleaseId(installerId, releaseId)
                .orElseThrow(() -> BizException.notFound("Installer", installerId));
    }

    public void delete(Long appId, Long releaseId, Long installerId) {
        Release release = releaseService.get(appId, releaseId);
        if (!release.getStatus().acceptsArtifacts()) {
            throw BizException.conflict("Release " + release.getVersion() + " is archived; its installers are frozen");
        }
        Installer installer = installerMapper.selectByIdAndReleaseId(installerId, releaseId)
                .orElseThrow(() -> BizException.notFound("Installer", installerId));
        installerMapper.deleteById(installer.getId());
    }
}
