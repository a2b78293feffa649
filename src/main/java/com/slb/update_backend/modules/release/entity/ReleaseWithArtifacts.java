package com.slb.update_backend.modules.release.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 已发布版本及其产物快照，供更新解析使用（MyBatis collection 映射）。
 */
@Data
public class ReleaseWithArtifacts {

    private Release release;

    private List<Artifact> artifacts = new ArrayList<>();
}
