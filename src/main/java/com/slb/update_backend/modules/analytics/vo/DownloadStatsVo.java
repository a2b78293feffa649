package com.slb.update_backend.modules.analytics.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "下载统计 / Download statistics")
public class DownloadStatsVo {

    @Schema(description = "总下载次数", example = "12345")
    private long totalDownloads;

    @Schema(description = "按版本统计，次数倒序")
    private List<CountVo> byVersion;

    @Schema(description = "按平台统计，次数倒序")
    private List<CountVo> byPlatform;

    @Schema(description = "按国家统计（includeCountries=true 时返回）", nullable = true)
    private List<CountVo> byCountry;

    @Schema(description = "统计区间")
    private Period period;

    @Data
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Period {
        @Schema(description = "起始时间（UTC，ISO 8601），未指定为 null", nullable = true)
        private String start;

        @Schema(description = "结束时间（UTC，ISO 8601），未指定为 null", nullable = true)
        private String end;

        public Period(String start, String end) {
            this.start = start;
            this.end = end;
        }
    }
}
