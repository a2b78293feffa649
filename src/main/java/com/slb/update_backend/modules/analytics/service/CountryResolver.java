package com.slb.update_backend.modules.analytics.service;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * 从 CDN / 边缘网关注入的请求头中取国家代码。
 */
public final class CountryResolver {

    // Cloudflare 对未知来源返回 XX，Tor 返回 T1
    private static final String CLOUDFLARE_UNKNOWN = "XX";

    private static final String[] HEADERS = {
            "CF-IPCountry",
            "X-Country-Code",
            "X-Vercel-IP-Country",
            "CloudFront-Viewer-Country"
    };

    private CountryResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        for (String header : HEADERS) {
            String value = request.getHeader(header);
            if (!StringUtils.hasText(value)) {
                continue;
            }
            String code = value.trim().toUpperCase(Locale.ROOT);
            if ("CF-IPCountry".equals(header) && CLOUDFLARE_UNKNOWN.equals(code)) {
                continue;
            }
            return code;
        }
        return null;
    }
}
