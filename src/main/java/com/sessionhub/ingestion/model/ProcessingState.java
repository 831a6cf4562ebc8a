package com.sessionhub.ingestion.model;

import java.util.List;

/**
 * Where a content record stands with respect to its linked assets.
 */
public enum ProcessingState {
    INGESTED,
    ACQUISITION_PENDING,
    READY,
    ACQUISITION_FAILED;

    /**
     * Derives the state from the record's current entries.
     */
    public static ProcessingState of(List<AssetEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return READY;
        }
        boolean failed = false;
        for (AssetEntry entry : entries) {
            if (entry.needsAcquisition()) {
                return ACQUISITION_PENDING;
            }
            if (entry.getResolutionState() == ResolutionState.FAILED) {
                failed = true;
            }
        }
        return failed ? ACQUISITION_FAILED : READY;
    }
}
