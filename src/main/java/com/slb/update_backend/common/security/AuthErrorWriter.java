package com.slb.update_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.update_backend.common.api.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 401 / 403 统一按 ApiResponse 输出。
 */
@Component
public class AuthErrorWriter implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public AuthErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        String header = request.getHeader("Authorization");
        ApiResponse<Void> body;
        if (!StringUtils.hasText(header)) {
            body = ApiResponse.error(401, "UNAUTHORIZED", "Missing Authorization: Bearer header",
                    Map.of("Authorization", "Required header not provided"));
        } else if (!header.startsWith("Bearer ")) {
            body = ApiResponse.error(401, "UNAUTHORIZED", "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <api-key>' format"));
        } else {
            body = ApiResponse.error(401, "UNAUTHORIZED", "Invalid or revoked API key", null);
        }
        write(response, 401, body);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, 403, ApiResponse.error(403, "FORBIDDEN",
                "API key scope does not permit this operation", null));
    }

    private void write(HttpServletResponse response, int status, ApiResponse<Void> body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
