package com.slb.update_backend.modules.update.model;

public enum NoUpdateReason {
    APP_NOT_FOUND,
    NO_UPDATE_AVAILABLE,
    NO_ARTIFACT_FOR_PLATFORM
}
