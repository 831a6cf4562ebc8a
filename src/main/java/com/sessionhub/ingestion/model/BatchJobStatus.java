package com.sessionhub.ingestion.model;

public enum BatchJobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
