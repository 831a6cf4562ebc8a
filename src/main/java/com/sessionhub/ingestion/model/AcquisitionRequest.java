package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.UUID;

/**
 * A deck entry that needs to be fetched and stored, as handed from the row loop to the scheduler.
 * Also serves as the queue message body in queue dispatch mode.
 */
public record AcquisitionRequest(UUID contentId, SlotType slotType, AssetEntry entry) {

    @JsonIgnore
    public AcquisitionKey key() {
        return new AcquisitionKey(contentId, slotType);
    }
}
