package com.slb.update_backend.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.update_backend.config.RateLimitProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitFilterTest {

    private MutableClock clock;
    private FixedWindowRateLimiter limiter;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        RateLimitProperties properties = new RateLimitProperties();
        properties.getPublicApi().setMaxRequests(2);
        limiter = new FixedWindowRateLimiter(clock, properties.maxEntryAge(), Duration.ofHours(1));
        filter = new RateLimitFilter(limiter, properties, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        limiter.close();
    }

    @Test
    void policyFor_shouldSelectByPath() {
        assertEquals(Optional.of(RateLimitPolicy.ADMIN), RateLimitFilter.policyFor("/admin/apps"));
        assertEquals(Optional.of(RateLimitPolicy.CI), RateLimitFilter.policyFor("/ci/apps/acme/releases"));
        assertEquals(Optional.of(RateLimitPolicy.PUBLIC), RateLimitFilter.policyFor("/acme/update/darwin-aarch64/1.0.0"));
        assertEquals(Optional.of(RateLimitPolicy.PUBLIC), RateLimitFilter.policyFor("/acme/download/darwin-universal"));
        assertEquals(Optional.empty(), RateLimitFilter.policyFor("/health/ready"));
        assertEquals(Optional.empty(), RateLimitFilter.policyFor("/v3/api-docs"));
    }

    @Test
    void doFilter_shouldSetHeadersAndRejectOverLimit() throws Exception {
        MockHttpServletResponse first = call("/acme/update/darwin-aarch64/1.0.0");
        MockHttpServletResponse second = call("/acme/update/darwin-aarch64/1.0.0");
        MockHttpServletResponse third = call("/acme/update/darwin-aarch64/1.0.0");

        assertEquals(200, first.getStatus());
        assertEquals("2", first.getHeader("X-RateLimit-Limit"));
        assertEquals("1", first.getHeader("X-RateLimit-Remaining"));
        assertEquals(String.valueOf(Instant.parse("2026-01-01T00:01:00Z").getEpochSecond()),
                first.getHeader("X-RateLimit-Reset"));
        assertEquals("0", second.getHeader("X-RateLimit-Remaining"));

        assertEquals(429, third.getStatus());
        assertEquals("60", third.getHeader("Retry-After"));
        assertTrue(third.getContentAsString().contains("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void doFilter_shouldNotLimitHealthChecks() throws Exception {
        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse response = call("/health");
            assertEquals(200, response.getStatus());
            assertNull(response.getHeader("X-RateLimit-Limit"));
        }
    }

    private MockHttpServletResponse call(String uri) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.addHeader("X-Forwarded-For", "203.0.113.7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
