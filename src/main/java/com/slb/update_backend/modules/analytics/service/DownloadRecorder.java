package com.slb.update_backend.modules.analytics.service;

import com.slb.update_backend.config.AnalyticsExecutorConfig;
import com.slb.update_backend.modules.analytics.entity.DownloadEvent;
import com.slb.update_backend.modules.analytics.enums.DownloadType;
import com.slb.update_backend.modules.analytics.mapper.DownloadEventMapper;
import com.slb.update_backend.modules.update.model.InstallerMatch;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 下载事件写入。异步写入至多一次：失败（含线程池队列已满）只记 warn，不影响下载响应。
 */
@Service
@Slf4j
public class DownloadRecorder {

    private final DownloadEventMapper downloadEventMapper;
    private final Executor executor;
    private final Clock clock;

    public DownloadRecorder(DownloadEventMapper downloadEventMapper,
                            @Qualifier(AnalyticsExecutorConfig.ANALYTICS_EXECUTOR) Executor executor,
                            Clock clock) {
        this.downloadEventMapper = downloadEventMapper;
        this.executor = executor;
        this.clock = clock;
    }

    public void record(DownloadEvent event) {
        downloadEventMapper.insert(event);
    }

    public void recordAsync(DownloadEvent event) {
        try {
            executor.execute(() -> {
                try {
                    record(event);
                } catch (RuntimeException e) {
                    log.warn("Failed to record download event: appId={}, version={}, platform={}, cause={}",
                            event.getAppId(), event.getVersion(), event.getPlatform(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Analytics queue full, dropping download event: appId={}, version={}",
                    event.getAppId(), event.getVersion());
        }
    }

    public void recordUpdate(UpdateDecision.UpdateAvailable update, @Nullable String country) {
        DownloadEvent event = newEvent(update.app().getId(), update.platform(),
                update.release().getVersion(), country, DownloadType.UPDATE);
        event.setArtifactId(update.artifact().getId());
        recordAsync(event);
    }

    public void recordInstaller(InstallerMatch match, @Nullable String country) {
        DownloadEvent event = newEvent(match.app().getId(), match.installer().getPlatform(),
                match.release().getVersion(), country, DownloadType.INSTALLER);
        event.setInstallerId(match.installer().getId());
        recordAsync(event);
    }

    private DownloadEvent newEvent(Long appId, String platform, String version,
                                   @Nullable String country, DownloadType type) {
        DownloadEvent event = new DownloadEvent();
        event.setAppId(appId);
        event.setPlatform(platform);
        event.setVersion(version);
        event.setIpCountry(country);
        event.setDownloadType(type);
        event.setDownloadedAt(LocalDateTime.now(clock));
        return event;
    }
}
