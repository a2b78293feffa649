package com.slb.update_backend.modules.analytics.vo;

import com.slb.update_backend.modules.analytics.enums.TimeSeriesPeriod;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "下载时间序列，空桶补 0")
public class TimeSeriesVo {

    @Schema(description = "应用 ID")
    private Long appId;

    @Schema(description = "区间：24h / 7d / 30d / 90d", example = "7d")
    private TimeSeriesPeriod period;

    @Schema(description = "数据点，按时间升序，首尾均包含")
    private List<TimeSeriesPointVo> data;
}
