package com.slb.update_backend.modules.analytics.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "时间序列数据点")
public class TimeSeriesPointVo {

    @Schema(description = "时间桶起点（UTC，ISO 8601）", example = "2026-01-07T21:00:00Z")
    private String timestamp;

    @Schema(description = "该时间桶内的下载次数", example = "3")
    private long count;
}
