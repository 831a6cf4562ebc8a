package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.StoreFileMetadata;

import java.nio.file.Path;

/**
 * Minimal access to the structured document store holding deck files.
 */
public interface StructuredStoreClient {

    StoreFileMetadata getMetadata(String fileId);

    /**
     * Exports a native document to {@code targetMimeType} and returns the number of bytes written.
     */
    long exportFile(String fileId, String targetMimeType, Path target);

    /**
     * Downloads the raw bytes of a non-native file and returns the number of bytes written.
     */
    long downloadFile(String fileId, Path target);

    /**
     * Fetches an arbitrary URL with the store's credentials and returns the number of bytes written.
     */
    long fetchAuthenticated(String url, Path target);
}
