package com.slb.update_backend.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.update_backend.common.api.ApiResponse;
import com.slb.update_backend.common.security.AppAccessGuard;
import com.slb.update_backend.config.RateLimitProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 按路径选择限流策略，放在 API Key 认证之后，以便已认证请求按 key 计数。
 */
@Component
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Pattern PUBLIC_PATH = Pattern.compile("^/[^/]+/(update|download)/.*");

    private final FixedWindowRateLimiter rateLimiter;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitFilter(FixedWindowRateLimiter rateLimiter, RateLimitProperties properties,
                           ObjectMapper objectMapper, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        Optional<RateLimitPolicy> policy = properties.isEnabled()
                ? policyFor(pathOf(request))
                : Optional.empty();
        if (policy.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitPolicy p = policy.get();
        RateLimitProperties.Quota quota = properties.quotaFor(p);
        String clientKey = ClientKeyResolver.resolve(request, AppAccessGuard.currentPrincipal().orElse(null));
        RateLimitResult result = rateLimiter.check(p.storeKey(clientKey), quota.getMaxRequests(), quota.getWindow());

        response.setHeader("X-RateLimit-Limit", String.valueOf(result.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(result.resetEpochSeconds()));

        if (!result.allowed()) {
            long retryAfter = result.retryAfterSeconds(clock.millis());
            log.warn("Rate limit exceeded: policy={}, client={}, path={}", p, clientKey, request.getRequestURI());
            response.setHeader("Retry-After", String.valueOf(retryAfter));
            response.setStatus(429);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    ApiResponse.rateLimited("Too many requests, retry in " + retryAfter + "s", retryAfter));
            return;
        }
        filterChain.doFilter(request, response);
    }

    static Optional<RateLimitPolicy> policyFor(String path) {
        if (path.startsWith("/admin/")) {
            return Optional.of(RateLimitPolicy.ADMIN);
        }
        if (path.startsWith("/ci/")) {
            return Optional.of(RateLimitPolicy.CI);
        }
        if (path.startsWith("/health") || path.startsWith("/v3/") || path.startsWith("/swagger-ui")) {
            return Optional.empty();
        }
        if (PUBLIC_PATH.matcher(path).matches()) {
            return Optional.of(RateLimitPolicy.PUBLIC);
        }
        return Optional.empty();
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String context = request.getContextPath();
        if (context != null && !context.isEmpty() && uri.startsWith(context)) {
            uri = uri.substring(context.length());
        }
        return uri;
    }
}
