package com.slb.update_backend.modules.analytics.service;

import com.slb.update_backend.config.UpdateProperties;
import com.slb.update_backend.modules.analytics.entity.DownloadEvent;
import com.slb.update_backend.modules.analytics.enums.DownloadType;
import com.slb.update_backend.modules.analytics.mapper.DownloadEventMapper;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.entity.ReleaseWithArtifacts;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.update.model.InstallerMatch;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import com.slb.update_backend.modules.update.service.ReleaseCatalog;
import com.slb.update_backend.modules.update.service.UpdateResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DownloadRecorderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T14:37:12Z"), ZoneOffset.UTC);

    @Mock
    DownloadEventMapper downloadEventMapper;

    @Mock
    ReleaseCatalog releaseCatalog;

    private App app;
    private Release release;

    @BeforeEach
    void setUp() {
        app = new App();
        app.setId(1L);
        release = new Release();
        release.setId(10L);
        release.setVersion("1.1.0");
    }

    @Test
    void recordUpdate_shouldStoreRequestedPlatformAndArtifact() {
        DownloadRecorder recorder = new DownloadRecorder(downloadEventMapper, Runnable::run, CLOCK);
        Artifact artifact = new Artifact();
        artifact.setId(100L);
        artifact.setPlatform("darwin-universal");

        recorder.recordUpdate(new UpdateDecision.UpdateAvailable(app, release, artifact, "darwin-aarch64"), "DE");

        ArgumentCaptor<DownloadEvent> captor = ArgumentCaptor.forClass(DownloadEvent.class);
        verify(downloadEventMapper).insert(captor.capture());
        DownloadEvent event = captor.getValue();
        assertThat(event.getPlatform()).isEqualTo("darwin-aarch64");
        assertThat(event.getArtifactId()).isEqualTo(100L);
        assertThat(event.getInstallerId()).isNull();
        assertThat(event.getDownloadType()).isEqualTo(DownloadType.UPDATE);
        assertThat(event.getIpCountry()).isEqualTo("DE");
        assertThat(event.getDownloadedAt()).isEqualTo(LocalDateTime.of(2026, 3, 10, 14, 37, 12));
    }

    @Test
    void recordUpdate_shouldKeepRequestedPlatformWhenResolverFallsBackToUniversal() {
        release.setAppId(1L);
        release.setStatus(ReleaseStatus.PUBLISHED);
        Artifact universal = new Artifact();
        universal.setId(100L);
        universal.setReleaseId(10L);
        universal.setPlatform("darwin-universal");
        universal.setSignature("sig-u");
        universal.setDownloadUrl("https://cdn.example.com/acme/darwin-universal.tar.gz");
        ReleaseWithArtifacts published = new ReleaseWithArtifacts();
        published.setRelease(release);
        published.setArtifacts(List.of(universal));
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(app));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(published));

        UpdateResolver resolver = new UpdateResolver(releaseCatalog, new UpdateProperties());
        DownloadRecorder recorder = new DownloadRecorder(downloadEventMapper, Runnable::run, CLOCK);
        UpdateDecision decision = resolver.resolve("acme", "macos-arm64", "1.0.0");
        assertThat(decision).isInstanceOf(UpdateDecision.UpdateAvailable.class);

        recorder.recordUpdate((UpdateDecision.UpdateAvailable) decision, "US");

        // 统计按请求平台记录，artifact 指向实际命中的 universal 包
        ArgumentCaptor<DownloadEvent> captor = ArgumentCaptor.forClass(DownloadEvent.class);
        verify(downloadEventMapper).insert(captor.capture());
        assertThat(captor.getValue().getPlatform()).isEqualTo("darwin-aarch64");
        assertThat(captor.getValue().getArtifactId()).isEqualTo(100L);
        assertThat(captor.getValue().getVersion()).isEqualTo("1.1.0");
    }

    @Test
    void recordInstaller_shouldStoreInstallerPlatform() {
        DownloadRecorder recorder = new DownloadRecorder(downloadEventMapper, Runnable::run, CLOCK);
        Installer installer = new Installer();
        installer.setId(200L);
        installer.setPlatform("windows-x86_64");

        recorder.recordInstaller(new InstallerMatch(app, release, installer), null);

        ArgumentCaptor<DownloadEvent> captor = ArgumentCaptor.forClass(DownloadEvent.class);
        verify(downloadEventMapper).insert(captor.capture());
        assertThat(captor.getValue().getDownloadType()).isEqualTo(DownloadType.INSTALLER);
        assertThat(captor.getValue().getInstallerId()).isEqualTo(200L);
        assertThat(captor.getValue().getIpCountry()).isNull();
    }

    @Test
    void recordAsync_shouldNotPropagateStorageFailure() {
        DownloadRecorder recorder = new DownloadRecorder(downloadEventMapper, Runnable::run, CLOCK);
        doThrow(new DataAccessResourceFailureException("db down")).when(downloadEventMapper).insert(any());

        assertThatCode(() -> recorder.recordAsync(new DownloadEvent())).doesNotThrowAnyException();
    }

    @Test
    void recordAsync_shouldDropEventWhenQueueIsFull() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        DownloadRecorder recorder = new DownloadRecorder(downloadEventMapper, full, CLOCK);

        assertThatCode(() -> recorder.recordAsync(new DownloadEvent())).doesNotThrowAnyException();
        verifyNoInteractions(downloadEventMapper);
    }
}
