package com.slb.update_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "ApiKeyAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tauri 更新服务 API / Tauri Update Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                为 Tauri plugin-updater 提供检查更新接口，并为发布流程提供版本、更新包、安装包管理与下载统计。
                                Serves the Tauri plugin-updater check endpoint and provides release, artifact, installer
                                management plus download analytics for the publishing workflow.

                                2. 接口分组 / API Groups
                                - 公开接口 / Public: GET /{app_slug}/update/{target}/{current_version}，
                                  GET /{app_slug}/update/{target}/{arch}/{current_version}，GET /{app_slug}/download/{platform}
                                - 管理端 / Admin: /admin/**（需要 admin scope 的 API Key）
                                - CI: /ci/**（需要 ci 或 admin scope 的 API Key）

                                3. 返回结构 / Response Envelope
                                检查更新接口返回 Tauri 要求的裸 JSON（200）或 204 No Content；其余接口统一使用 ApiResponse<T>：
                                The update check returns the bare JSON Tauri expects (200) or 204 No Content; every other API
                                uses ApiResponse<T>:
                                - code: 0 表示成功，否则与 HTTP 状态码一致 / 0 on success, otherwise the HTTP status
                                - message / data / traceId / error{code, errors, retryAfter}

                                4. 限流 / Rate Limiting
                                固定窗口限流：公开接口 60 次/分钟，管理端 100 次/分钟，CI 30 次/分钟。
                                响应头 X-RateLimit-Limit / X-RateLimit-Remaining / X-RateLimit-Reset；超限返回 429 与 Retry-After。
                                """
                        )
                )
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .description("API Key，格式为：Bearer {api-key}")
                        )
                );
    }
}
