package com.slb.update_backend.modules.analytics.model;

import lombok.Data;

/**
 * GROUP BY 查询的通用结果行：key 为分组值（版本、平台、国家、时间桶等）。
 */
@Data
public class CountRow {

    private String key;

    private long count;
}
