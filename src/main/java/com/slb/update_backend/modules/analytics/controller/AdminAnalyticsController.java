package com.slb.update_backend.modules.analytics.controller;

import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.modules.analytics.enums.TimeSeriesPeriod;
import com.slb.update_backend.modules.analytics.service.AnalyticsService;
import com.slb.update_backend.modules.analytics.vo.DownloadStatsVo;
import com.slb.update_backend.modules.analytics.vo.DownloadSummaryVo;
import com.slb.update_backend.modules.analytics.vo.ReleaseDownloadStatsVo;
import com.slb.update_backend.modules.analytics.vo.TimeSeriesVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/admin/apps/{appId}")
@Tag(name = "管理员/下载统计", description = "按版本、平台、国家统计下载，以及时间序列")
public class AdminAnalyticsController {

    private final AnalyticsService analyticsService;
    private final AppAccessGuard appAccessGuard;

    public AdminAnalyticsController(AnalyticsService analyticsService, AppAccessGuard appAccessGuard) {
        this.analyticsService = analyticsService;
        this.appAccessGuard = appAccessGuard;
    }

    @GetMapping({"/analytics", "/analytics/downloads"})
    @Operation(
            summary = "下载统计",
            description = """
                    startDate / endDate 为 ISO 8601（如 2026-01-01T00:00:00Z 或 2026-01-01），均可省略。

                    示例请求 (cURL):
                    curl "http://localhost:8080/admin/apps/1/analytics?startDate=2026-01-01&includeCountries=true" \\
                      -H "Authorization: Bearer <admin-key>"
                    """
    )
    public ApiResponse<DownloadStatsVo> stats(
            @PathVariable Long appId,
            @Parameter(description = "起始时间（含）", example = "2026-01-01T00:00:00Z")
            @RequestParam(required = false) String startDate,
            @Parameter(description = "结束时间（含）", example = "2026-01-31T23:59:59Z")
            @RequestParam(required = false) String endDate,
            @Parameter(description = "是否返回国家维度", example = "true")
            @RequestParam(defaultValue = "false") boolean includeCountries) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(analyticsService.stats(appId,
                parseUtc("startDate", startDate), parseUtc("endDate", endDate), includeCountries));
    }

    @GetMapping("/analytics/timeseries")
    @Operation(summary = "下载时间序列", description = "period: 24h（按小时）/ 7d / 30d / 90d（按天），空桶补 0。")
    public ApiResponse<TimeSeriesVo> timeSeries(
            @PathVariable Long appId,
            @Parameter(description = "区间", example = "7d")
            @RequestParam(defaultValue = "7d") String period) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(analyticsService.timeSeries(appId, TimeSeriesPeriod.fromCode(period)));
    }

    @GetMapping("/analytics/summary")
    @Operation(summary = "下载汇总", description = "更新包与安装包分开统计，并按版本、平台拆分。")
    public ApiResponse<DownloadSummaryVo> summary(@PathVariable Long appId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(analyticsService.summary(appId));
    }

    @GetMapping("/releases/{releaseId}/analytics")
    @Operation(summary = "单个版本的下载统计")
    public ApiResponse<ReleaseDownloadStatsVo> releaseStats(@PathVariable Long appId, @PathVariable Long releaseId) {
        appAccessGuard.check(appId);
        return ApiResponse.ok(analyticsService.releaseStats(appId, releaseId));
    }

    static LocalDateTime parseUtc(String field, String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String v = value.trim();
        try {
            // 纯日期按当天 00:00 UTC 处理
            if (v.indexOf('T') < 0) {
                return LocalDate.parse(v).atStartOfDay();
            }
            return OffsetDateTime.parse(v).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            throw new BizException(400, field + " must be an ISO 8601 date or date-time, got '" + v + "'");
        }
    }
}
