package com.sessionhub.ingestion.model;

import java.util.List;

/**
 * The artifact of the first strategy that succeeded, with the log of every strategy tried up to it.
 */
public record DownloadOutcome(DownloadedAsset asset, List<AcquisitionAttempt> attempts) {
}
