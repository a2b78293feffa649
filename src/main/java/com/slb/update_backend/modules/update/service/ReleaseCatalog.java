package com.slb.update_backend.modules.update.service;

import com.slb.update_backend.common.exception.StorageUnavailableException;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.mapper.AppMapper;
import com.slb.update_backend.modules.release.entity.ReleaseWithArtifacts;
import com.slb.update_backend.modules.release.entity.ReleaseWithInstallers;
import com.slb.update_backend.modules.release.mapper.ReleaseMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 更新解析的只读数据源。存储异常统一包装为 {@link StorageUnavailableException}，不会被当成“没有更新”。
 */
@Component
public class ReleaseCatalog {

    private final AppMapper appMapper;
    private final ReleaseMapper releaseMapper;

    public ReleaseCatalog(AppMapper appMapper, ReleaseMapper releaseMapper) {
        this.appMapper = appMapper;
        this.releaseMapper = releaseMapper;
    }

    public Optional<App> findAppBySlug(String slug) {
        try {
            return appMapper.findBySlug(slug);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to load app '" + slug + "'", e);
        }
    }

    public List<ReleaseWithArtifacts> findPublishedWithArtifacts(Long appId) {
        try {
            return releaseMapper.findPublishedWithArtifacts(appId);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to load published releases for app " + appId, e);
        }
    }

    public List<ReleaseWithInstallers> findPublishedWithInstallers(Long appId) {
        try {
            return releaseMapper.findPublishedWithInstallers(appId);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to load installers for app " + appId, e);
        }
    }
}
