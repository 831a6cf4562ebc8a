package com.sessionhub.ingestion.model;

import java.util.List;

/**
 * Outcome of running one acquisition task to completion.
 */
public record AcquisitionResult(AcquisitionKey key, Status status, AssetEntry entry,
                                List<AcquisitionAttempt> attempts, String error) {

    public enum Status {
        RESOLVED,
        /** Every strategy failed. */
        EXHAUSTED,
        /** Download succeeded but the upload did not. */
        STORAGE_FAILED,
        /** Unexpected failure outside the strategy chain, e.g. the record could not be saved. */
        ERROR
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
