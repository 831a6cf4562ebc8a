package com.sessionhub.ingestion.model;

import java.nio.file.Path;

/**
 * A non-empty local artifact produced by one acquisition strategy.
 *
 * @param discoveredName provider file name when the structured store reported one, else null
 */
public record DownloadedAsset(Path file, long size, String mimeType, String discoveredName, String strategyName) {

    public DownloadedAsset withSize(long actualSize) {
        return new DownloadedAsset(file, actualSize, mimeType, discoveredName, strategyName);
    }
}
