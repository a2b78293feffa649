package com.slb.update_backend.modules.update.model;

import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.release.entity.Installer;
import com.slb.update_backend.modules.release.entity.Release;

public record InstallerMatch(App app, Release release, Installer installer) {
}
