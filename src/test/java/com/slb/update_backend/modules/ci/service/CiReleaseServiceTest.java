package com.slb.update_backend.modules.ci.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.service.AppService;
import com.slb.update_backend.modules.ci.dto.CiReleaseDto;
import com.slb.update_backend.modules.ci.vo.CiReleaseVo;
import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.release.service.ArtifactService;
import com.slb.update_backend.modules.release.service.ReleaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CiReleaseServiceTest {

    @Mock
    AppService appService;
    @Mock
    ReleaseService releaseService;
    @Mock
    ArtifactService artifactService;
    @Mock
    AppAccessGuard appAccessGuard;

    private CiReleaseService ciReleaseService;
    private App app;

    @BeforeEach
    void setUp() {
        ciReleaseService = new CiReleaseService(appService, releaseService, artifactService, appAccessGuard);
        app = new App();
        app.setId(1L);
        app.setSlug("acme");
    }

    private static ArtifactCreateDto artifact(String platform) {
        ArtifactCreateDto dto = new ArtifactCreateDto();
        dto.setPlatform(platform);
        dto.setDownloadUrl("https://cdn.example.com/" + platform);
        return dto;
    }

    private static CiReleaseDto dto(boolean autoPublish, ArtifactCreateDto... artifacts) {
        CiReleaseDto dto = new CiReleaseDto();
        dto.setVersion("2.0.0");
        dto.setArtifacts(List.of(artifacts));
        dto.setAutoPublish(autoPublish);
        return dto;
    }

    private static Release release(ReleaseStatus status) {
        Release r = new Release();
        r.setId(20L);
        r.setAppId(1L);
        r.setVersion("2.0.0");
        r.setStatus(status);
        return r;
    }

    @Test
    void release_shouldCreateAttachAndPublish() {
        Release draft = release(ReleaseStatus.DRAFT);
        when(appService.getBySlug("acme")).thenReturn(app);
        when(releaseService.create(eq(1L), any())).thenReturn(draft);
        when(artifactService.attach(eq(draft), any())).thenReturn(new Artifact());
        when(releaseService.publish(1L, 20L)).thenReturn(release(ReleaseStatus.PUBLISHED));

        CiReleaseVo vo = ciReleaseService.release("acme",
                dto(true, artifact("darwin-aarch64"), artifact("windows-x86_64")));

        assertEquals(ReleaseStatus.PUBLISHED, vo.getRelease().getStatus());
        assertEquals(2, vo.getArtifacts().size());
        verify(appAccessGuard).check(1L);
    }

    @Test
    void release_shouldLeaveDraftWithoutAutoPublish() {
        when(appService.getBySlug("acme")).thenReturn(app);
        when(releaseService.create(eq(1L), any())).thenReturn(release(ReleaseStatus.DRAFT));

        CiReleaseVo vo = ciReleaseService.release("acme", dto(false));

        assertEquals(ReleaseStatus.DRAFT, vo.getRelease().getStatus());
        verify(releaseService, never()).publish(anyLong(), anyLong());
    }

    @Test
    void release_shouldRejectDuplicatePlatformsAfterAliasing() {
        when(appService.getBySlug("acme")).thenReturn(app);

        BizException e = assertThrows(BizException.class, () -> ciReleaseService.release("acme",
                dto(true, artifact("darwin-aarch64"), artifact("macos-arm64"))));
        assertEquals(400, e.getCode());
        verify(releaseService, never()).create(anyLong(), any());
    }

    @Test
    void release_shouldStopWhenKeyIsBoundToOtherApp() {
        when(appService.getBySlug("acme")).thenReturn(app);
        doThrow(new BizException(403, "forbidden")).when(appAccessGuard).check(1L);

        BizException e = assertThrows(BizException.class, () -> ciReleaseService.release("acme", dto(false)));
        assertEquals(403, e.getCode());
        verifyNoInteractions(releaseService);
    }
}
