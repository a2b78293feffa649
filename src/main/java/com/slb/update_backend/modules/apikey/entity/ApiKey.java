package com.slb.update_backend.modules.apikey.entity;

import com.slb.update_backend.modules.apikey.enums.ApiKeyScope;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * API Key 记录。明文只在签发时出现一次，库里只存 SHA-256。
 */
@Data
public class ApiKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    // 为 null 时不限应用
    private Long appId;

    private String name;

    private String keyHash;

    private ApiKeyScope scope;

    private LocalDateTime lastUsedAt;

    private LocalDateTime createdAt;

    private LocalDateTime revokedAt;
}
