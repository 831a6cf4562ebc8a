package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AcquisitionAttempt;
import com.sessionhub.ingestion.model.AcquisitionAttempt.Outcome;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadOutcome;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.service.AcquisitionExhaustedException;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the ordered acquisition strategies against one entry until one produces a non-empty file.
 */
@Service
public class ResilientDownloader {

    private static final Logger logger = LoggerFactory.getLogger(ResilientDownloader.class);

    private final List<AcquisitionStrategy> strategies;
    private final String tempDirectory;

    public ResilientDownloader(List<AcquisitionStrategy> strategies,
                               @Value("${app.acquisition.temp-dir:}") String tempDirectory) {
        this.strategies = List.copyOf(strategies);
        this.tempDirectory = tempDirectory;
    }

    /**
     * Fetches the entry into a temporary file owned by the caller.
     *
     * @throws AcquisitionExhaustedException when no strategy succeeded; carries one attempt per strategy
     */
    public DownloadOutcome fetch(AssetEntry entry) {
        Path target = createTarget(entry);
        List<AcquisitionAttempt> attempts = new ArrayList<>();
        Throwable lastError = null;

        for (AcquisitionStrategy strategy : strategies) {
            String name = strategy.name();
            try {
                Optional<DownloadedAsset> result = strategy.attempt(entry, target);
                if (result.isEmpty()) {
                    attempts.add(new AcquisitionAttempt(name, Outcome.SKIPPED, "not applicable"));
                    continue;
                }
                long actualSize = Files.exists(target) ? Files.size(target) : 0L;
                if (actualSize <= 0) {
                    lastError = new AcquisitionStrategyException(name + " produced an empty file");
                    attempts.add(new AcquisitionAttempt(name, Outcome.EMPTY, "empty artifact"));
                    logger.warn("Strategy {} produced an empty file for {}", name, describe(entry));
                    continue;
                }
                attempts.add(AcquisitionAttempt.succeeded(name, actualSize + " bytes"));
                logger.info("Strategy {} fetched {} bytes for {}", name, actualSize, describe(entry));
                return new DownloadOutcome(result.get().withSize(actualSize), List.copyOf(attempts));
            } catch (Exception e) {
                lastError = e;
                attempts.add(AcquisitionAttempt.failed(name, e.getMessage()));
                logger.warn("Strategy {} failed for {}: {}", name, describe(entry), e.getMessage());
                logger.debug("Strategy {} failure detail", name, e);
            }
        }

        deleteQuietly(target);
        String message = "All " + strategies.size() + " acquisition strategies failed for " + describe(entry);
        logger.error(message);
        throw new AcquisitionExhaustedException(message, attempts, lastError);
    }

    private Path createTarget(AssetEntry entry) {
        try {
            if (tempDirectory == null || tempDirectory.isBlank()) {
                return Files.createTempFile("asset-", ".part");
            }
            Path dir = Files.createDirectories(Paths.get(tempDirectory));
            return Files.createTempFile(dir, "asset-", ".part");
        } catch (IOException e) {
            throw new AcquisitionExhaustedException("Could not create a temporary file for " + describe(entry),
                    List.of(), e);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    private static String describe(AssetEntry entry) {
        return entry.getSlotType() + " (" + (entry.getExternalId() != null
                ? entry.getExternalId() : entry.getExternalReference()) + ")";
    }
}
