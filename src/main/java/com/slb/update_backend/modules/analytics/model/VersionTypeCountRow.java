package com.slb.update_backend.modules.analytics.model;

import com.slb.update_backend.modules.analytics.enums.DownloadType;
import lombok.Data;

@Data
public class VersionTypeCountRow {

    private String version;

    private Long releaseId;

    private DownloadType downloadType;

    private long count;
}
