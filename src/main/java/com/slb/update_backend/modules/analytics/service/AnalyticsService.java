package com.slb.update_backend.modules.analytics.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.modules.analytics.enums.DownloadType;
import com.slb.update_backend.modules.analytics.enums.TimeSeriesPeriod;
import com.slb.update_backend.modules.analytics.mapper.DownloadEventMapper;
import com.slb.update_backend.modules.analytics.model.CountRow;
import com.slb.update_backend.modules.analytics.model.VersionTypeCountRow;
import com.slb.update_backend.modules.analytics.vo.CountVo;
import com.slb.update_backend.modules.analytics.vo.DownloadStatsVo;
import com.slb.update_backend.modules.analytics.vo.DownloadSummaryVo;
import com.slb.update_backend.modules.analytics.vo.ReleaseDownloadStatsVo;
import com.slb.update_backend.modules.analytics.vo.TimeSeriesPointVo;
import com.slb.update_backend.modules.analytics.vo.TimeSeriesVo;
import com.slb.update_backend.modules.analytics.vo.VersionBreakdownVo;
import com.slb.update_backend.modules.app.mapper.AppMapper;
import com.slb.update_backend.modules.release.entity.Release;
import com.slb.update_backend.modules.release.mapper.ReleaseMapper;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AnalyticsService {

    static final String UNKNOWN_COUNTRY = "Unknown";

    // 与 DownloadEventMapper.countByBucket 中的 DATE_FORMAT 输出一致
    private static final DateTimeFormatter BUCKET_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AppMapper appMapper;
    private final ReleaseMapper releaseMapper;
    private final DownloadEventMapper downloadEventMapper;
    private final Clock clock;

    public AnalyticsService(AppMapper appMapper,
                            ReleaseMapper releaseMapper,
                            DownloadEventMapper downloadEventMapper,
                            Clock clock) {
        this.appMapper = appMapper;
        this.releaseMapper = releaseMapper;
        this.downloadEventMapper = downloadEventMapper;
        this.clock = clock;
    }

    /**
     * 按版本、平台（可选国家）分组计数；start / end 均为闭区间，可为空。
     */
    public DownloadStatsVo stats(Long appId, @Nullable LocalDateTime start, @Nullable LocalDateTime end,
                                 boolean includeCountries) {
        requireApp(appId);
        if (start != null && end != null && start.isAfter(end)) {
            throw new BizException(400, "startDate must not be after endDate");
        }

        DownloadStatsVo vo = new DownloadStatsVo();
        vo.setTotalDownloads(downloadEventMapper.countByApp(appId, start, end));
        vo.setByVersion(toCounts(downloadEventMapper.countByVersion(appId, start, end)));
        vo.setByPlatform(toCounts(downloadEventMapper.countByPlatform(appId, start, end)));
        if (includeCountries) {
            List<CountVo> countries = new ArrayList<>();
            for (CountRow row : downloadEventMapper.countByCountry(appId, start, end)) {
                countries.add(new CountVo(row.getKey() == null ? UNKNOWN_COUNTRY : row.getKey(), row.getCount()));
            }
            vo.setByCountry(countries);
        }
        vo.setPeriod(new DownloadStatsVo.Period(isoOrNull(start), isoOrNull(end)));
        return vo;
    }

    /**
     * 从 truncate(now - period) 到 truncate(now) 的连续时间桶（首尾都包含），空桶补 0。
     * 24h 为 25 个小时桶，7d / 30d / 90d 分别为 8 / 31 / 91 个天桶。
     */
    public TimeSeriesVo timeSeries(Long appId, TimeSeriesPeriod period) {
        requireApp(appId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime first = now.minus(period.getLength()).truncatedTo(period.getBucketUnit());
        LocalDateTime last = now.truncatedTo(period.getBucketUnit());

        Map<String, Long> counts = new HashMap<>();
        for (CountRow row : downloadEventMapper.countByBucket(appId, first, period.isHourly())) {
            counts.merge(row.getKey(), row.getCount(), Long::sum);
        }

        List<TimeSeriesPointVo> points = new ArrayList<>();
        for (LocalDateTime t = first; !t.isAfter(last); t = t.plus(1, period.getBucketUnit())) {
            points.add(new TimeSeriesPointVo(iso(t), counts.getOrDefault(BUCKET_KEY.format(t), 0L)));
        }
        return new TimeSeriesVo(appId, period, points);
    }

    public DownloadSummaryVo summary(Long appId) {
        requireApp(appId);

        Map<DownloadType, Long> totals = byType(downloadEventMapper.countByType(appId, null));
        Map<String, VersionBreakdownVo> versions = new LinkedHashMap<>();
        for (VersionTypeCountRow row : downloadEventMapper.countByVersionAndType(appId)) {
            VersionBreakdownVo v = versions.computeIfAbsent(row.getVersion(), key -> {
                VersionBreakdownVo created = new VersionBreakdownVo();
                created.setVersion(key);
                return created;
            });
            if (v.getReleaseId() == null) {
                v.setReleaseId(row.getReleaseId());
            }
            if (row.getDownloadType() == DownloadType.INSTALLER) {
                v.setInstallerDownloads(v.getInstallerDownloads() + row.getCount());
            } else {
                v.setUpdateDownloads(v.getUpdateDownloads() + row.getCount());
            }
            v.setTotalDownloads(v.getUpdateDownloads() + v.getInstallerDownloads());
        }
        List<VersionBreakdownVo> byVersion = new ArrayList<>(versions.values());
        byVersion.sort(Comparator.comparingLong(VersionBreakdownVo::getTotalDownloads).reversed());

        DownloadSummaryVo vo = new DownloadSummaryVo();
        vo.setAppId(appId);
        vo.setTotalUpdateDownloads(totals.getOrDefault(DownloadType.UPDATE, 0L));
        vo.setTotalInstallerDownloads(totals.getOrDefault(DownloadType.INSTALLER, 0L));
        vo.setTotalDownloads(vo.getTotalUpdateDownloads() + vo.getTotalInstallerDownloads());
        vo.setByVersion(byVersion);
        vo.setByPlatform(toCounts(downloadEventMapper.countByPlatform(appId, null, null)));
        return vo;
    }

    public ReleaseDownloadStatsVo releaseStats(Long appId, Long releaseId) {
        requireApp(appId);
        Release release = releaseMapper.selectByIdAndAppId(releaseId, appId)
                .orElseThrow(() -> BizException.notFound("Release", releaseId));

        Map<DownloadType, Long> totals = byType(downloadEventMapper.countByType(appId, release.getVersion()));
        ReleaseDownloadStatsVo vo = new ReleaseDownloadStatsVo();
        vo.setReleaseId(release.getId());
        vo.setVersion(release.getVersion());
        vo.setUpdateDownloads(totals.getOrDefault(DownloadType.UPDATE, 0L));
        vo.setInstallerDownloads(totals.getOrDefault(DownloadType.INSTALLER, 0L));
        vo.setTotalDownloads(vo.getUpdateDownloads() + vo.getInstallerDownloads());
        vo.setByPlatform(toCounts(downloadEventMapper.countByPlatformForVersion(appId, release.getVersion())));
        return vo;
    }

    private void requireApp(Long appId) {
        appMapper.selectById(appId).orElseThrow(() -> BizException.notFound("App", appId));
    }

    private static Map<DownloadType, Long> byType(List<CountRow> rows) {
        Map<DownloadType, Long> totals = new HashMap<>();
        for (CountRow row : rows) {
            if (row.getKey() != null) {
                totals.merge(DownloadType.valueOf(row.getKey()), row.getCount(), Long::sum);
            }
        }
        return totals;
    }

    private static List<CountVo> toCounts(List<CountRow> rows) {
        return rows.stream().map(r -> new CountVo(r.getKey(), r.getCount())).toList();
    }

    private static String iso(LocalDateTime utc) {
        return DateTimeFormatter.ISO_INSTANT.format(utc.toInstant(ZoneOffset.UTC));
    }

    private static String isoOrNull(@Nullable LocalDateTime utc) {
        return utc == null ? null : iso(utc);
    }
}
