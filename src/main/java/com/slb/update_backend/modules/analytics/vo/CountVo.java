package com.slb.update_backend.modules.analytics.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "分组计数 / Grouped count")
public class CountVo {

    @Schema(description = "分组值：版本号、平台或国家代码（未知国家为 Unknown）", example = "1.2.0")
    private String key;

    @Schema(description = "下载次数", example = "42")
    private long count;
}
