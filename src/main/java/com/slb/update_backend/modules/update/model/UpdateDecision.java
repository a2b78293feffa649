package com.slb.update_backend.modules.update.model;

import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.release.entity.Artifact;
import com.slb.update_backend.modules.release.entity.Release;

/**
 * 检查更新的结果：要么没有更新（带原因），要么给出具体的版本与产物。
 */
public interface UpdateDecision {

    static UpdateDecision none(NoUpdateReason reason) {
        return new NoUpdate(reason);
    }

    record NoUpdate(NoUpdateReason reason) implements UpdateDecision {
    }

    /**
     * @param platform 客户端请求的 canonical 平台；回退命中时实际平台见 {@code artifact.getPlatform()}
     */
    record UpdateAvailable(App app, Release release, Artifact artifact, String platform) implements UpdateDecision {
    }
}
