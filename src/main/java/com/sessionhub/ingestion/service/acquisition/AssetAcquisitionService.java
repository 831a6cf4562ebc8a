package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AcquisitionAttempt;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AcquisitionResult;
import com.sessionhub.ingestion.model.AcquisitionResult.Status;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadOutcome;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.StoredObject;
import com.sessionhub.ingestion.service.AcquisitionExhaustedException;
import com.sessionhub.ingestion.service.StorageException;
import com.sessionhub.ingestion.service.download.ResilientDownloader;
import com.sessionhub.ingestion.service.storage.StorageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Fetch, store and merge for one acquisition request.
 */
@Service
public class AssetAcquisitionService {

    private static final Logger logger = LoggerFactory.getLogger(AssetAcquisitionService.class);

    private final ResilientDownloader downloader;
    private final StorageSink storageSink;
    private final ContentStoreUpdater contentStoreUpdater;

    public AssetAcquisitionService(ResilientDownloader downloader,
                                   StorageSink storageSink,
                                   ContentStoreUpdater contentStoreUpdater) {
        this.downloader = downloader;
        this.storageSink = storageSink;
        this.contentStoreUpdater = contentStoreUpdater;
    }

    /**
     * Resolves the request's entry. Exhaustion marks the entry FAILED on the record; a storage
     * failure leaves the record untouched. Both are reported in the result, not thrown.
     */
    public AcquisitionResult acquire(AcquisitionRequest request) {
        UUID contentId = request.contentId();
        AssetEntry entry = request.entry();
        logger.info("Acquiring {} for content {}", request.slotType(), contentId);

        DownloadOutcome outcome;
        try {
            outcome = downloader.fetch(entry);
        } catch (AcquisitionExhaustedException e) {
            String error = lastError(e);
            contentStoreUpdater.markFailed(contentId, entry, error);
            return new AcquisitionResult(request.key(), Status.EXHAUSTED, entry, e.getAttempts(), error);
        }

        DownloadedAsset asset = outcome.asset();
        List<AcquisitionAttempt> attempts = outcome.attempts();
        try {
            AssetEntry staged = entry.toBuilder().mimeType(asset.mimeType()).build();
            StoredObject stored = storageSink.store(asset.file(), staged, contentId);
            AssetEntry resolved = staged.toBuilder()
                    .resolvedLocation(stored.location())
                    .accessUrl(stored.accessUrl())
                    .resolutionState(ResolutionState.RESOLVED)
                    .tooLargeToExport(null)
                    .acquisitionError(null)
                    .byteSize(asset.size())
                    .displayName(asset.discoveredName() != null ? asset.discoveredName() : entry.getDisplayName())
                    .build();
            contentStoreUpdater.merge(contentId, resolved);
            logger.info("Resolved {} for content {} via {} into {}", request.slotType(), contentId,
                    asset.strategyName(), stored.location());
            return new AcquisitionResult(request.key(), Status.RESOLVED, resolved, attempts, null);
        } catch (StorageException e) {
            logger.error("Storing {} for content {} failed", request.slotType(), contentId, e);
            return new AcquisitionResult(request.key(), Status.STORAGE_FAILED, entry, attempts, e.getMessage());
        } finally {
            deleteTemp(asset.file());
        }
    }

    private String lastError(AcquisitionExhaustedException e) {
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return e.getMessage();
    }

    private void deleteTemp(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
