package com.slb.update_backend.modules.apikey.enums;

/**
 * API Key 权限范围
 */
public enum ApiKeyScope {
    ADMIN, // 管理端：应用、版本、产物、统计
    CI     // 流水线：仅创建/发布版本
}
