package com.slb.update_backend.common.security;

import com.slb.update_backend.common.exception.BizException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 绑定到单个应用的 API Key 只能访问该应用。
 */
@Component
public class AppAccessGuard {

    public void check(Long appId) {
        currentPrincipal().ifPresent(principal -> {
            if (!principal.canAccessApp(appId)) {
                throw new BizException(403, "API key is not allowed to access app " + appId);
            }
        });
    }

    public static Optional<ApiKeyPrincipal> currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof ApiKeyPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }
}
