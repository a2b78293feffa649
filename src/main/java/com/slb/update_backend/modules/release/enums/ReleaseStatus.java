package com.slb.update_backend.modules.release.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 版本生命周期：DRAFT -> PUBLISHED -> ARCHIVED，另允许 DRAFT -> ARCHIVED。
 * ARCHIVED 为终态。
 */
public enum ReleaseStatus {
    DRAFT,      // 草稿：可编辑、可删除、可挂产物
    PUBLISHED,  // 已发布：对客户端可见，不可删除
    ARCHIVED;   // 已归档：历史记录，不可再挂产物

    public boolean canPublish() {
        return this == DRAFT;
    }

    public boolean canArchive() {
        return this == DRAFT || this == PUBLISHED;
    }

    public boolean canDelete() {
        return this == DRAFT;
    }

    /**
     * CI 自动发布流程先在草稿上挂产物再发布，因此 DRAFT 与 PUBLISHED 都允许。
     */
    public boolean acceptsArtifacts() {
        return this != ARCHIVED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReleaseStatus fromCode(String code) {
        if (code == null) return null;
        for (ReleaseStatus s : values()) {
            if (s.name().equalsIgnoreCase(code.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown release status: " + code);
    }
}
