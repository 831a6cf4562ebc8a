package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One independent way of fetching an asset. Implementations are Spring beans ordered with
 * {@code @Order}; the downloader tries them in that order until one yields a non-empty file.
 */
public interface AcquisitionStrategy {

    /**
     * Name recorded in the attempt log.
     */
    String name();

    /**
     * Writes the asset to {@code target}.
     *
     * @return the artifact, or empty if this strategy does not apply to the entry
     * @throws Exception any failure; the downloader logs it and moves on to the next strategy
     */
    Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) throws Exception;
}
