package com.slb.update_backend.common.ratelimit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 进程内固定窗口限流器。
 *
 * <p>每个 key 的读改写都在 {@link ConcurrentHashMap#compute} 内完成：同一 key 串行，不同 key 互不竞争。
 * 后台单线程定期清理超过 maxEntryAge 的条目，清理与活跃 key 竞争时最多把该 key 重置为新窗口。</p>
 */
@Slf4j
public class FixedWindowRateLimiter implements AutoCloseable {

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxEntryAge;
    private final ScheduledExecutorService sweeper;

    public FixedWindowRateLimiter(Clock clock, Duration maxEntryAge, Duration sweepInterval) {
        this.clock = clock;
        this.maxEntryAge = maxEntryAge;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("rate-limit-sweeper-%d")
                .setDaemon(true)
                .build());
        long intervalMillis = Math.max(sweepInterval.toMillis(), 1L);
        this.sweeper.scheduleAtFixedRate(this::sweepQuietly, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    public RateLimitResult check(String key, int limit, Duration window) {
        long now = clock.millis();
        long windowMillis = window.toMillis();
        // compute 的 lambda 不能直接返回结果，用数组带出
        RateLimitResult[] result = new RateLimitResult[1];
        store.compute(key, (k, entry) -> {
            if (entry == null || now - entry.windowStart() >= windowMillis) {
                result[0] = new RateLimitResult(true, limit, limit - 1, resetSeconds(now, windowMillis));
                return new Entry(1, now);
            }
            long reset = resetSeconds(entry.windowStart(), windowMillis);
            if (entry.count() >= limit) {
                result[0] = new RateLimitResult(false, limit, 0, reset);
                return entry;
            }
            int count = entry.count() + 1;
            result[0] = new RateLimitResult(true, limit, Math.max(limit - count, 0), reset);
            return new Entry(count, entry.windowStart());
        });
        return result[0];
    }

    public void reset(String key) {
        store.remove(key);
    }

    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }

    public Optional<Entry> snapshot(String key) {
        return Optional.ofNullable(store.get(key));
    }

    /**
     * 删除 windowStart 早于 now - maxEntryAge 的条目，返回删除数量。
     */
    public int sweep() {
        long cutoff = clock.millis() - maxEntryAge.toMillis();
        int before = store.size();
        store.entrySet().removeIf(e -> e.getValue().windowStart() < cutoff);
        return Math.max(before - store.size(), 0);
    }

    private void sweepQuietly() {
        try {
            int removed = sweep();
            if (removed > 0) {
                log.debug("Rate limit sweep removed {} stale entries, {} remaining", removed, store.size());
            }
        } catch (RuntimeException e) {
            // 异常会终止 scheduleAtFixedRate 的后续执行，这里记录后继续
            log.warn("Rate limit sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    private static long resetSeconds(long windowStart, long windowMillis) {
        return Math.floorDiv(windowStart + windowMillis + 999L, 1000L);
    }

    public record Entry(int count, long windowStart) {
    }
}
