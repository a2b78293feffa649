package com.slb.update_backend.config;

import com.slb.update_backend.common.ratelimit.FixedWindowRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RateLimiterConfig {

    @Bean(destroyMethod = "close")
    public FixedWindowRateLimiter fixedWindowRateLimiter(Clock clock, RateLimitProperties properties) {
        return new FixedWindowRateLimiter(clock, properties.maxEntryAge(), properties.getSweepInterval());
    }
}
