package com.slb.update_backend.modules.ci.vo;

import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "CI 发布结果")
public class CiReleaseVo {

    private Release release;

    private List<Artifact> artifacts;
}
