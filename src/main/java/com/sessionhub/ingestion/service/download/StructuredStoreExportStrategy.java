package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Fetches by the entry's known external id.
 */
@Component
@Order(10)
public class StructuredStoreExportStrategy extends AbstractStructuredStoreStrategy {

    public StructuredStoreExportStrategy(StructuredStoreClient storeClient) {
        super(storeClient);
    }

    @Override
    public String name() {
        return "structured-store-export";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) {
        if (entry.getExternalId() == null || !isStructuredStoreEntry(entry)) {
            return Optional.empty();
        }
        return fetchById(entry.getExternalId(), entry, target);
    }
}
