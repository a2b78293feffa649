package com.slb.update_backend.modules.release.vo;

import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.Release;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "版本详情（含更新包、安装包）")
public class ReleaseDetailVo {

    @Schema(description = "版本")
    private Release release;

    @Schema(description = "更新包列表")
    private List<Artifact> artifacts;

    @Schema(description = "安装包列表")
    private List<Installer> installers;
}
