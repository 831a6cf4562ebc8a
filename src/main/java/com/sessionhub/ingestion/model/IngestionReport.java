package com.sessionhub.ingestion.model;

import java.util.List;
import java.util.UUID;

/**
 * What the row loop produced: created records, row errors and the acquisition work it found.
 */
public record IngestionReport(int processed, int successful, int failed,
                              List<UUID> createdRecordIds,
                              List<RowError> errors,
                              List<AcquisitionRequest> acquisitionRequests) {
}
