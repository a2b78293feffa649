package com.slb.update_backend.modules.analytics.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DownloadType {
    UPDATE,     // Tauri updater 拉取更新包
    INSTALLER;  // 安装包下载

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
