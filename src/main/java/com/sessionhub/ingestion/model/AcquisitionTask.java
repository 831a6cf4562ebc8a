package com.sessionhub.ingestion.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory unit of acquisition work for one {@link AcquisitionKey}.
 * Mutated by a single worker thread and read by the registry, so accessors are synchronized.
 */
public class AcquisitionTask {

    private final AcquisitionRequest request;
    private final OffsetDateTime createdAt;
    private final List<AcquisitionAttempt> attempts = new ArrayList<>();
    private AcquisitionTaskState state = AcquisitionTaskState.PENDING;
    private String lastError;

    public AcquisitionTask(AcquisitionRequest request) {
        this.request = request;
        this.createdAt = OffsetDateTime.now();
    }

    public AcquisitionKey getKey() {
        return request.key();
    }

    public AcquisitionRequest getRequest() {
        return request;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized AcquisitionTaskState getState() {
        return state;
    }

    public synchronized void start() {
        this.state = AcquisitionTaskState.IN_PROGRESS;
    }

    public synchronized void succeed(List<AcquisitionAttempt> log) {
        attempts.addAll(log);
        this.state = AcquisitionTaskState.SUCCEEDED;
    }

    public synchronized void fail(List<AcquisitionAttempt> log, String error) {
        attempts.addAll(log);
        this.lastError = error;
        this.state = AcquisitionTaskState.FAILED;
    }

    public synchronized List<AcquisitionAttempt> getAttempts() {
        return Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public synchronized String getLastError() {
        return lastError;
    }
}
