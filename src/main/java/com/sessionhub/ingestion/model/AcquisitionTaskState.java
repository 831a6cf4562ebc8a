package com.sessionhub.ingestion.model;

public enum AcquisitionTaskState {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
