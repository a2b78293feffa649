package com.slb.update_backend.common.security;

import com.slb.update_backend.modules.apikey.entity.ApiKey;
import com.slb.update_backend.modules.apikey.mapper.ApiKeyMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * {@code Authorization: Bearer <api-key>} 认证。
 *
 * <p>无效或吊销的 key 不会直接拒绝，而是保持未认证状态，由 SecurityConfig 的授权规则决定 401/403。</p>
 */
@Component
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final ApiKeyMapper apiKeyMapper;

    public ApiKeyAuthenticationFilter(ApiKeyMapper apiKeyMapper) {
        this.apiKeyMapper = apiKeyMapper;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            resolveKey(request).ifPresent(key -> {
                ApiKeyPrincipal principal = new ApiKeyPrincipal(key.getId(), key.getAppId(), key.getScope());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
                SecurityContextHolder.getContext().setAuthentication(authentication);
            });
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        return !StringUtils.hasText(header) || !header.startsWith(BEARER);
    }

    private Optional<ApiKey> resolveKey(HttpServletRequest request) {
        String token = request.getHeader("Authorization").substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return apiKeyMapper.findActiveByKeyHash(sha256Hex(token));
        } catch (DataAccessException e) {
            // 认证存储不可用：按未认证处理，受保护接口返回 401
            log.error("API key lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String sha256Hex(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
