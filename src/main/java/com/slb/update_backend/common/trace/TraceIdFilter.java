package com.slb.update_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * 为每个请求绑定 traceId 并输出一行访问日志。
 *
 * <p>客户端传入的 X-Trace-Id 仅在长度不超过 64 且全部为可见 ASCII 时沿用，否则重新生成。
 * 公开的检查更新 / 下载请求量大，访问日志记为 debug；管理与 CI 接口记为 info。</p>
 */
@Component
@Slf4j
public class TraceIdFilter extends OncePerRequestFilter {

    private static final int MAX_SUPPLIED_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String supplied = request.getHeader(TraceIdHolder.TRACE_ID_HEADER);
        String traceId = isUsable(supplied) ? supplied.trim() : TraceIdHolder.newTraceId();
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);

        long started = System.nanoTime();
        try (TraceIdHolder.Scope ignored = TraceIdHolder.open(traceId)) {
            filterChain.doFilter(request, response);
        } finally {
            logAccess(request, response.getStatus(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), traceId);
        }
    }

    private static void logAccess(HttpServletRequest request, int status, long elapsedMs, String traceId) {
        String path = request.getRequestURI();
        if (isManagementPath(path)) {
            log.info("{} {} -> {} ({} ms) traceId={}", request.getMethod(), path, status, elapsedMs, traceId);
        } else if (log.isDebugEnabled()) {
            log.debug("{} {} -> {} ({} ms) traceId={}", request.getMethod(), path, status, elapsedMs, traceId);
        }
    }

    private static boolean isManagementPath(String path) {
        return path != null && (path.startsWith("/admin/") || path.startsWith("/ci/"));
    }

    private static boolean isUsable(String supplied) {
        if (!StringUtils.hasText(supplied)) return false;
        String s = supplied.trim();
        return s.length() <= MAX_SUPPLIED_LENGTH && s.chars().allMatch(ch -> ch > 0x20 && ch < 0x7f);
    }
}
