package com.slb.update_backend.modules.analytics.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.modules.analytics.enums.DownloadType;
import com.slb.update_backend.modules.analytics.enums.TimeSeriesPeriod;
import com.slb.update_backend.modules.analytics.mapper.DownloadEventMapper;
import com.slb.update_backend.modules.analytics.model.CountRow;
import com.slb.update_backend.modules.analytics.model.VersionTypeCountRow;
import com.slb.update_backend.modules.analytics.vo.DownloadStatsVo;
import com.slb.update_backend.modules.analytics.vo.DownloadSummaryVo;
import com.slb.update_backend.modules.analytics.vo.TimeSeriesPointVo;
import com.slb.update_backend.modules.analytics.vo.TimeSeriesVo;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.mapper.AppMapper;
import com.slb.update_backend.modules.release.mapper.ReleaseMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    @Mock
    AppMapper appMapper;
    @Mock
    ReleaseMapper releaseMapper;
    @Mock
    DownloadEventMapper downloadEventMapper;

    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T14:37:12Z"), ZoneOffset.UTC);
        analyticsService = new AnalyticsService(appMapper, releaseMapper, downloadEventMapper, clock);
    }

    private static CountRow row(String key, long count) {
        CountRow row = new CountRow();
        row.setKey(key);
        row.setCount(count);
        return row;
    }

    private static VersionTypeCountRow versionRow(String version, DownloadType type, long count) {
        VersionTypeCountRow row = new VersionTypeCountRow();
        row.setVersion(version);
        row.setDownloadType(type);
        row.setCount(count);
        return row;
    }

    @Test
    void timeSeries_shouldFillEveryHourOfLastDay() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(downloadEventMapper.countByBucket(eq(1L), any(), eq(true)))
                .thenReturn(List.of(row("2026-03-10 14:00:00", 3)));

        TimeSeriesVo vo = analyticsService.timeSeries(1L, TimeSeriesPeriod.LAST_24_HOURS);

        List<TimeSeriesPointVo> data = vo.getData();
        assertEquals(25, data.size());
        assertEquals("2026-03-09T14:00:00Z", data.get(0).getTimestamp());
        assertEquals("2026-03-09T15:00:00Z", data.get(1).getTimestamp());
        assertEquals("2026-03-10T14:00:00Z", data.get(24).getTimestamp());
        assertEquals(3, data.get(24).getCount());
        assertEquals(3, data.stream().mapToLong(TimeSeriesPointVo::getCount).sum());
        verify(downloadEventMapper).countByBucket(1L, LocalDateTime.of(2026, 3, 9, 14, 0), true);
    }

    @Test
    void timeSeries_shouldReturnZeroPointsWhenNoDownloads() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(downloadEventMapper.countByBucket(eq(1L), any(), eq(true))).thenReturn(List.of());

        List<TimeSeriesPointVo> data = analyticsService.timeSeries(1L, TimeSeriesPeriod.LAST_24_HOURS).getData();

        assertEquals(25, data.size());
        assertEquals("2026-03-09T14:00:00Z", data.get(0).getTimestamp());
        assertEquals("2026-03-10T14:00:00Z", data.get(24).getTimestamp());
        for (int i = 0; i < data.size(); i++) {
            assertEquals(0, data.get(i).getCount());
            if (i > 0) {
                Instant prev = Instant.parse(data.get(i - 1).getTimestamp());
                assertEquals(prev.plusSeconds(3600), Instant.parse(data.get(i).getTimestamp()));
            }
        }
    }

    @Test
    void timeSeries_shouldUseDailyBucketsForWeek() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(downloadEventMapper.countByBucket(eq(1L), any(), anyBoolean()))
                .thenReturn(List.of(row("2026-03-05 00:00:00", 7)));

        TimeSeriesVo vo = analyticsService.timeSeries(1L, TimeSeriesPeriod.LAST_7_DAYS);

        assertEquals(8, vo.getData().size());
        assertEquals("2026-03-03T00:00:00Z", vo.getData().get(0).getTimestamp());
        assertEquals(7, vo.getData().get(2).getCount());
        assertEquals(0, vo.getData().get(7).getCount());
    }

    @Test
    void stats_shouldLabelMissingCountryUnknown() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(downloadEventMapper.countByApp(1L, null, null)).thenReturn(5L);
        when(downloadEventMapper.countByVersion(1L, null, null)).thenReturn(List.of(row("1.1.0", 5)));
        when(downloadEventMapper.countByPlatform(1L, null, null)).thenReturn(List.of(row("darwin-universal", 5)));
        when(downloadEventMapper.countByCountry(1L, null, null)).thenReturn(List.of(row("DE", 3), row(null, 2)));

        DownloadStatsVo vo = analyticsService.stats(1L, null, null, true);

        assertEquals(5, vo.getTotalDownloads());
        assertEquals("Unknown", vo.getByCountry().get(1).getKey());
        assertNull(vo.getPeriod().getStart());
    }

    @Test
    void stats_shouldRejectInvertedRange() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        LocalDateTime start = LocalDateTime.of(2026, 3, 2, 0, 0);

        BizException e = assertThrows(BizException.class,
                () -> analyticsService.stats(1L, start, start.minusDays(1), false));
        assertEquals(400, e.getCode());
        verifyNoInteractions(downloadEventMapper);
    }

    @Test
    void summary_shouldSplitUpdateAndInstallerDownloads() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(downloadEventMapper.countByType(1L, null))
                .thenReturn(List.of(row("UPDATE", 10), row("INSTALLER", 4)));
        when(downloadEventMapper.countByVersionAndType(1L)).thenReturn(List.of(
                versionRow("1.0.0", DownloadType.UPDATE, 2),
                versionRow("1.1.0", DownloadType.UPDATE, 8),
                versionRow("1.1.0", DownloadType.INSTALLER, 4)));
        when(downloadEventMapper.countByPlatform(1L, null, null)).thenReturn(List.of());

        DownloadSummaryVo vo = analyticsService.summary(1L);

        assertEquals(14, vo.getTotalDownloads());
        assertEquals(4, vo.getTotalInstallerDownloads());
        assertEquals("1.1.0", vo.getByVersion().get(0).getVersion());
        assertEquals(12, vo.getByVersion().get(0).getTotalDownloads());
    }

    @Test
    void releaseStats_shouldReturn404ForReleaseOfOtherApp() {
        when(appMapper.selectById(1L)).thenReturn(Optional.of(new App()));
        when(releaseMapper.selectByIdAndAppId(9L, 1L)).thenReturn(Optional.empty());

        BizException e = assertThrows(BizException.class, () -> analyticsService.releaseStats(1L, 9L));
        assertEquals(404, e.getCode());
    }
}
