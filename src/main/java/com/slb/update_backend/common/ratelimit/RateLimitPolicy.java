package com.slb.update_backend.common.ratelimit;

import java.time.Duration;
import java.util.Locale;

/**
 * 限流策略及默认配额，可被 app.rate-limit.* 覆盖。
 */
public enum RateLimitPolicy {
    PUBLIC(60, Duration.ofMinutes(1)),   // 客户端检查更新 / 下载安装包
    ADMIN(100, Duration.ofMinutes(1)),   // 管理端
    CI(30, Duration.ofMinutes(1));       // CI 发布

    private final int defaultMaxRequests;
    private final Duration defaultWindow;

    RateLimitPolicy(int defaultMaxRequests, Duration defaultWindow) {
        this.defaultMaxRequests = defaultMaxRequests;
        this.defaultWindow = defaultWindow;
    }

    public int getDefaultMaxRequests() {
        return defaultMaxRequests;
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public String storeKey(String clientKey) {
        return name().toLowerCase(Locale.ROOT) + "|" + clientKey;
    }
}
