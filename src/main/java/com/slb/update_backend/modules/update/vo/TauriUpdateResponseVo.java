package com.slb.update_backend.modules.update.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.slb.update_backend.modules.update.model.UpdateDecision;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Tauri plugin-updater 动态服务器响应。
 *
 * <p>注意：该接口返回必须是“裸 JSON”，不能包装 ApiResponse。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "notes", "pub_date", "url", "signature"})
@Schema(description = "Tauri plugin-updater 动态服务器响应")
public class TauriUpdateResponseVo {

    @Schema(description = "新版本号", example = "1.2.0")
    private String version;

    @Schema(description = "更新说明", example = "修复若干已知问题", nullable = true)
    private String notes;

    @JsonProperty("pub_date")
    @Schema(description = "发布时间（RFC 3339，UTC，带 Z）", example = "2026-01-07T21:20:48Z", nullable = true)
    private String pubDate;

    @Schema(description = "更新包下载地址")
    private String url;

    @Schema(description = "签名：.sig 文件内容", nullable = true)
    private String signature;

    public static TauriUpdateResponseVo from(UpdateDecision.UpdateAvailable update) {
        TauriUpdateResponseVo vo = new TauriUpdateResponseVo();
        vo.setVersion(update.release().getVersion());
        vo.setNotes(update.release().getNotes());
        if (update.release().getPubDate() != null) {
            // 数据库存的是 UTC；统一输出 ISO_INSTANT（带 Z）
            vo.setPubDate(DateTimeFormatter.ISO_INSTANT.format(update.release().getPubDate().toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS)));
        }
        vo.setUrl(update.artifact().getDownloadUrl());
        vo.setSignature(update.artifact().getSignature());
        return vo;
    }
}
