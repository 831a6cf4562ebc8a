package com.sessionhub.ingestion.service.storage;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.StoredObject;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Durable blob storage for acquired assets.
 */
public interface StorageSink {

    /**
     * Uploads the file under the record's prefix and returns its location and an access URL.
     *
     * @throws com.sessionhub.ingestion.service.StorageException if the upload or URL generation fails
     */
    StoredObject store(Path file, AssetEntry entry, UUID contentId);
}
