package com.slb.update_backend.common.ratelimit;

import com.slb.update_backend.common.security.ApiKeyPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * 限流客户端标识：已认证 key > X-Forwarded-For 第一跳 > CF-Connecting-IP > X-Real-IP > ip:unknown。
 */
public final class ClientKeyResolver {

    public static final String UNKNOWN = "ip:unknown";

    private ClientKeyResolver() {
    }

    public static String resolve(HttpServletRequest request, @Nullable ApiKeyPrincipal principal) {
        if (principal != null && principal.id() != null) {
            return "key:" + principal.id();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return "ip:" + first;
            }
        }
        for (String header : new String[]{"CF-Connecting-IP", "X-Real-IP"}) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                return "ip:" + value.trim();
            }
        }
        return UNKNOWN;
    }
}
