package com.slb.update_backend.config;

import com.slb.update_backend.common.ratelimit.RateLimitPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.stream.Stream;

@Component
@ConfigurationProperties(prefix = "app.rate-limit")
@Data
public class RateLimitProperties {

    private boolean enabled = true;

    /**
     * 后台清理过期条目的周期。
     */
    private Duration sweepInterval = Duration.ofMinutes(5);

    private Quota publicApi = Quota.of(RateLimitPolicy.PUBLIC);
    private Quota admin = Quota.of(RateLimitPolicy.ADMIN);
    private Quota ci = Quota.of(RateLimitPolicy.CI);

    public Quota quotaFor(RateLimitPolicy policy) {
        return switch (policy) {
            case PUBLIC -> publicApi;
            case ADMIN -> admin;
            case CI -> ci;
        };
    }

    /**
     * 条目最长保留时间：最长窗口的两倍。
     */
    public Duration maxEntryAge() {
        Duration longest = Stream.of(publicApi, admin, ci)
                .map(Quota::getWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ofMinutes(1));
        return longest.multipliedBy(2);
    }

    @Data
    public static class Quota {
        private int maxRequests;
        private Duration window;

        static Quota of(RateLimitPolicy policy) {
            Quota q = new Quota();
            q.setMaxRequests(policy.getDefaultMaxRequests());
            q.setWindow(policy.getDefaultWindow());
            return q;
        }
    }
}
