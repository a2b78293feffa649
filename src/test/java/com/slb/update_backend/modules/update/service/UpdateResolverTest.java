package com.slb.update_backend.modules.update.service;

import com.slb.update_backend.common.exception.StorageUnavailableException;
import com.slb.update_backend.config.UpdateProperties;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.entity.ReleaseWithArtifacts;
import com.slb.update_backend.modules.release.entity.ReleaseWithInstallers;
import com.slb.update_backend.modules.release.enums.ReleaseStatus;
import com.slb.update_backend.modules.update.model.InstallerMatch;
import com.slb.update_backend.modules.update.model.NoUpdateReason;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateResolverTest {

    @Mock
    ReleaseCatalog releaseCatalog;

    private UpdateProperties updateProperties;
    private UpdateResolver resolver;
    private App acme;

    @BeforeEach
    void setUp() {
        updateProperties = new UpdateProperties();
        resolver = new UpdateResolver(releaseCatalog, updateProperties);
        acme = new App();
        acme.setId(1L);
        acme.setSlug("acme");
        acme.setName("Acme");
    }

    @Test
    void resolve_shouldFallBackToUniversalBuild() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0", artifact(100L, "darwin-universal", "sig-u")),
                release(11L, "1.0.0", artifact(101L, "darwin-aarch64", "sig-a"))));

        UpdateDecision decision = resolver.resolve("acme", "darwin-aarch64", "1.0.0");

        UpdateDecision.UpdateAvailable update = assertInstanceOf(UpdateDecision.UpdateAvailable.class, decision);
        assertEquals("1.1.0", update.release().getVersion());
        assertEquals("darwin-aarch64", update.platform());
        assertEquals("darwin-universal", update.artifact().getPlatform());
        assertEquals(100L, update.artifact().getId());
    }

    @Test
    void resolve_shouldPreferExactPlatformOverFallback() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0",
                        artifact(100L, "darwin-universal", "sig-u"),
                        artifact(101L, "darwin-aarch64", "sig-a"))));

        UpdateDecision.UpdateAvailable update = assertInstanceOf(UpdateDecision.UpdateAvailable.class,
                resolver.resolve("acme", "macos-arm64", "1.0.0"));

        assertEquals("darwin-aarch64", update.platform());
    }

    @Test
    void resolve_shouldOrderBySemverNotByStorageOrder() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(1L, "1.9.0", artifact(1L, "linux-x86_64", "s")),
                release(2L, "1.10.0", artifact(2L, "linux-x86_64", "s")),
                release(3L, "1.10.0-rc.1", artifact(3L, "linux-x86_64", "s"))));

        UpdateDecision.UpdateAvailable update = assertInstanceOf(UpdateDecision.UpdateAvailable.class,
                resolver.resolve("acme", "linux64", "1.0.0"));

        assertEquals("1.10.0", update.release().getVersion());
    }

    @Test
    void resolve_shouldReportNoUpdateWhenAlreadyCurrent() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0", artifact(100L, "darwin-universal", "sig"))));

        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.NO_UPDATE_AVAILABLE),
                resolver.resolve("acme", "darwin-aarch64", "1.1.0"));
        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.NO_UPDATE_AVAILABLE),
                resolver.resolve("acme", "darwin-aarch64", "2.0.0"));
    }

    @Test
    void resolve_shouldNotLookPastNewestResolvableRelease() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0", artifact(100L, "linux-x86_64", "s")),
                release(11L, "2.0.0", artifact(101L, "windows-x86_64", "s"))));

        // 2.0.0 没有 linux 产物，1.1.0 是候选，但不比当前新
        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.NO_UPDATE_AVAILABLE),
                resolver.resolve("acme", "linux-x86_64", "1.5.0"));
    }

    @Test
    void resolve_shouldReportMissingArtifact() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0", artifact(100L, "windows-x86_64", "sig"))));

        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.NO_ARTIFACT_FOR_PLATFORM),
                resolver.resolve("acme", "linux-aarch64", "1.0.0"));
    }

    @Test
    void resolve_shouldReportUnknownApp() {
        when(releaseCatalog.findAppBySlug("ghost")).thenReturn(Optional.empty());

        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.APP_NOT_FOUND),
                resolver.resolve("ghost", "darwin-aarch64", "1.0.0"));
        verify(releaseCatalog, never()).findPublishedWithArtifacts(any());
    }

    @Test
    void resolve_shouldTreatUnparseableCurrentVersionAsNoUpdate() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.1.0", artifact(100L, "linux-x86_64", "s"))));

        assertEquals(new UpdateDecision.NoUpdate(NoUpdateReason.NO_UPDATE_AVAILABLE),
                resolver.resolve("acme", "linux-x86_64", "latest"));
    }

    @Test
    void resolve_shouldSkipUnsignedArtifactsWhenAppHasPublicKey() {
        acme.setPublicKey("dW50cnVzdGVkIGNvbW1lbnQ6IG1pbmlzaWdu");
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L)).thenReturn(List.of(
                release(10L, "1.2.0", artifact(100L, "windows-x86_64", null)),
                release(11L, "1.1.0", artifact(101L, "windows-x86_64", "sig"))));

        UpdateDecision.UpdateAvailable update = assertInstanceOf(UpdateDecision.UpdateAvailable.class,
                resolver.resolve("acme", "windows-x86_64", "1.0.0"));
        assertEquals("1.1.0", update.release().getVersion());

        updateProperties.setRequireSignatureWhenPublicKey(false);
        update = assertInstanceOf(UpdateDecision.UpdateAvailable.class,
                resolver.resolve("acme", "windows-x86_64", "1.0.0"));
        assertEquals("1.2.0", update.release().getVersion());
    }

    @Test
    void resolve_shouldPropagateStorageFailure() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithArtifacts(1L))
                .thenThrow(new StorageUnavailableException("db down", new QueryTimeoutException("timeout")));

        assertThrows(StorageUnavailableException.class, () -> resolver.resolve("acme", "linux-x86_64", "1.0.0"));
    }

    @Test
    void resolveInstaller_shouldPickNewestReleaseAlongFallbackChain() {
        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithInstallers(1L)).thenReturn(List.of(
                installers(10L, "1.0.0", installer(200L, "darwin-aarch64")),
                installers(11L, "1.1.0", installer(201L, "darwin-universal"))));

        InstallerMatch match = resolver.resolveInstaller("acme", "macos-aarch64").orElseThrow();

        assertEquals("1.1.0", match.release().getVersion());
        assertEquals(201L, match.installer().getId());
    }

    @Test
    void resolveInstaller_shouldBeEmptyForUnknownAppOrPlatform() {
        when(releaseCatalog.findAppBySlug("ghost")).thenReturn(Optional.empty());
        assertTrue(resolver.resolveInstaller("ghost", "linux-x86_64").isEmpty());

        when(releaseCatalog.findAppBySlug("acme")).thenReturn(Optional.of(acme));
        when(releaseCatalog.findPublishedWithInstallers(1L)).thenReturn(List.of(
                installers(10L, "1.0.0", installer(200L, "windows-x86_64"))));
        assertTrue(resolver.resolveInstaller("acme", "linux-x86_64").isEmpty());
    }

    private static ReleaseWithArtifacts release(Long id, String version, Artifact... artifacts) {
        ReleaseWithArtifacts r = new ReleaseWithArtifacts();
        r.setRelease(published(id, version));
        for (Artifact a : artifacts) {
            a.setReleaseId(id);
        }
        r.setArtifacts(List.of(artifacts));
        return r;
    }

    private static ReleaseWithInstallers installers(Long id, String version, Installer... installers) {
        ReleaseWithInstallers r = new ReleaseWithInstallers();
        r.setRelease(published(id, version));
        r.setInstallers(List.of(installers));
        return r;
    }

    private static Release published(Long id, String version) {
        Release release = new Release();
        release.setId(id);
        release.setAppId(1L);
        release.setVersion(version);
        release.setStatus(ReleaseStatus.PUBLISHED);
        release.setPubDate(LocalDateTime.of(2026, 1, 7, 21, 20, 48));
        return release;
    }

    private static Artifact artifact(Long id, String platform, String signature) {
        Artifact a = new Artifact();
        a.setId(id);
        a.setPlatform(platform);
        a.setSignature(signature);
        a.setDownloadUrl("https://cdn.example.com/acme/" + platform + ".tar.gz");
        return a;
    }

    private static Installer installer(Long id, String platform) {
        Installer i = new Installer();
        i.setId(id);
        i.setPlatform(platform);
        i.setFilename("acme-" + platform);
        i.setDownloadUrl("https://cdn.example.com/acme/installer-" + platform);
        return i;
    }
}
