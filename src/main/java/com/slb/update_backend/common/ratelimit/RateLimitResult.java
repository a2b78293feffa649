package com.slb.update_backend.common.ratelimit;

/**
 * 单次检查结果。resetEpochSeconds 为当前窗口结束时刻（向上取整到秒）。
 */
public record RateLimitResult(boolean allowed, int limit, int remaining, long resetEpochSeconds) {

    /**
     * Retry-After 秒数，至少 1 秒。
     */
    public long retryAfterSeconds(long nowEpochMillis) {
        long seconds = resetEpochSeconds - Math.floorDiv(nowEpochMillis, 1000L);
        return Math.max(seconds, 1L);
    }
}
