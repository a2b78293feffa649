package com.slb.update_backend.common.security;

import com.slb.update_backend.modules.apikey.enums.ApiKeyScope;
import org.springframework.lang.Nullable;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.Objects;

/**
 * 已认证的 API Key。appId 为 null 表示全局 key。
 */
public record ApiKeyPrincipal(Long id, @Nullable Long appId, ApiKeyScope scope) {

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + scope.name()));
    }

    public boolean canAccessApp(Long targetAppId) {
        return appId == null || Objects.equals(appId, targetAppId);
    }
}
