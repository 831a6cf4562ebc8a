package com.sessionhub.ingestion.model;

import java.util.UUID;

/**
 * Identifies one asset slot of one record; at most one acquisition runs per key.
 */
public record AcquisitionKey(UUID contentId, SlotType slotType) {

    @Override
    public String toString() {
        return contentId + "/" + slotType.getWireName();
    }
}
