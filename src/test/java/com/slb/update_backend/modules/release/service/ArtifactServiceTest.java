package com.slb.update_backend.modules.release.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.modules.release.dto.ArtifactCreateDto;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.release.mapper.ArtifactMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArtifactServiceTest {

    @Mock
    ArtifactMapper artifactMapper;
    @Mock
    ReleaseService releaseService;

    private ArtifactService artifactService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        artifactService = new ArtifactService(artifactMapper, releaseService, clock);
    }

    private static Release release(ReleaseStatus status) {
        Release r = new Release();
        r.setId(5L);
        r.setAppId(1L);
        r.setVersion("1.0.0");
        r.setStatus(status);
        return r;
    }

    private static ArtifactCreateDto dto(String platform, boolean replace) {
        ArtifactCreateDto dto = new ArtifactCreateDto();
        dto.setPlatform(platform);
        dto.setDownloadUrl("https://cdn.example.com/acme.app.tar.gz");
        dto.setSignature("SIG");
        dto.setReplace(replace);
        return dto;
    }

    @Test
    void attach_shouldNormalizePlatformAlias() {
        when(artifactMapper.findByReleaseIdAndPlatform(5L, "darwin-aarch64")).thenReturn(Optional.empty());
        when(artifactMapper.insert(any())).thenReturn(1);

        Artifact artifact = artifactService.attach(release(ReleaseStatus.DRAFT), dto("macos-arm64", false));

        assertEquals("darwin-aarch64", artifact.getPlatform());
        assertEquals(5L, artifact.getReleaseId());
        verify(artifactMapper).insert(artifact);
    }

    @Test
    void attach_shouldRejectArchivedRelease() {
        BizException e = assertThrows(BizException.class,
                () -> artifactService.attach(release(ReleaseStatus.ARCHIVED), dto("darwin-aarch64", false)));
        assertEquals(409, e.getCode());
        verifyNoInteractions(artifactMapper);
    }

    @Test
    void attach_shouldRejectUnknownPlatform() {
        BizException e = assertThrows(BizException.class,
                () -> artifactService.attach(release(ReleaseStatus.DRAFT), dto("amiga-m68k", false)));
        assertEquals(400, e.getCode());
    }

    @Test
    void attach_shouldConflictOnDuplicatePlatform() {
        Artifact existing = new Artifact();
        existing.setId(77L);
        when(artifactMapper.findByReleaseIdAndPlatform(5L, "linux-x86_64")).thenReturn(Optional.of(existing));

        BizException e = assertThrows(BizException.class,
                () -> artifactService.attach(release(ReleaseStatus.PUBLISHED), dto("linux-x86_64", false)));
        assertEquals(409, e.getCode());
        verify(artifactMapper, never()).insert(any());
    }

    @Test
    void attach_shouldReplaceWhenRequested() {
        Artifact existing = new Artifact();
        existing.setId(77L);
        when(artifactMapper.findByReleaseIdAndPlatform(5L, "linux-x86_64")).thenReturn(Optional.of(existing));
        when(artifactMapper.insert(any())).thenReturn(1);

        artifactService.attach(release(ReleaseStatus.DRAFT), dto("linux-x86_64", true));

        verify(artifactMapper).deleteById(77L);
        ArgumentCaptor<Artifact> inserted = ArgumentCaptor.forClass(Artifact.class);
        verify(artifactMapper).insert(inserted.capture());
        assertEquals("SIG", inserted.getValue().getSignature());
    }

    @Test
    void attach_shouldPropagateInsertFailureAfterReplacedArtifactDeleted() {
        Artifact existing = new Artifact();
        existing.setId(77L);
        when(artifactMapper.findByReleaseIdAndPlatform(5L, "linux-x86_64")).thenReturn(Optional.of(existing));
        when(artifactMapper.insert(any())).thenThrow(new DataAccessResourceFailureException("connection reset"));

        // 异常必须抛出事务边界，删除才会随之回滚
        assertThrows(DataAccessResourceFailureException.class,
                () -> artifactService.attach(release(ReleaseStatus.DRAFT), dto("linux-x86_64", true)));
        verify(artifactMapper).deleteById(77L);
    }

    @Test
    void createAndAttach_shouldRunInsideTransaction() throws NoSuchMethodException {
        assertNotNull(ArtifactService.class.getMethod("attach", Release.class, ArtifactCreateDto.class)
                .getAnnotation(Transactional.class));
        assertNotNull(ArtifactService.class.getMethod("create", Long.class, Long.class, ArtifactCreateDto.class)
                .getAnnotation(Transactional.class));
    }

    @Test
    void attach_shouldConflictWhenReleaseArchivedConcurrently() {
        when(artifactMapper.findByReleaseIdAndPlatform(5L, "linux-x86_64")).thenReturn(Optional.empty());
        // 状态已在库里变成 ARCHIVED，带条件的 INSERT 不写入任何行
        when(artifactMapper.insert(any())).thenReturn(0);

        BizException e = assertThrows(BizException.class,
                () -> artifactService.attach(release(ReleaseStatus.PUBLISHED), dto("linux-x86_64", false)));
        assertEquals(409, e.getCode());
    }

    @Test
    void get_shouldReturn404ForArtifactOfOtherRelease() {
        when(releaseService.get(1L, 5L)).thenReturn(release(ReleaseStatus.DRAFT));
        when(artifactMapper.selectByIdAndReleaseId(88L, 5L)).thenReturn(Optional.empty());

        BizException e = assertThrows(BizException.class, () -> artifactService.get(1L, 5L, 88L));
        assertEquals(404, e.getCode());
    }
}
