package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.service.IdentifierExtractor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * For entries without a known id: derives one from the entry's links, then fetches like the export strategy.
 */
@Component
@Order(20)
public class DerivedIdStrategy extends AbstractStructuredStoreStrategy {

    public DerivedIdStrategy(StructuredStoreClient storeClient) {
        super(storeClient);
    }

    @Override
    public String name() {
        return "structured-store-derived-id";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) {
        if (entry.getExternalId() != null || !isStructuredStoreEntry(entry)) {
            return Optional.empty();
        }
        Optional<String> derivedId = Stream.of(entry.getExternalReference(), entry.getExportUrl(), entry.getAccessUrl())
                .map(IdentifierExtractor::extractStructuredStoreId)
                .filter(Objects::nonNull)
                .findFirst();
        if (derivedId.isEmpty()) {
            return Optional.empty();
        }
        return fetchById(derivedId.get(), entry, target);
    }
}
