package com.slb.update_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 下载统计异步写入线程池。队列满时丢弃（至多一次）。
 */
@Component
@ConfigurationProperties(prefix = "app.analytics")
@Data
public class AnalyticsProperties {

    private int coreSize = 2;
    private int maxSize = 4;
    private int queueCapacity = 1000;
}
