package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.model.MimeTypes;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Pulls the export-style link through the structured store's transport, reusing its bearer token.
 * This is the path that still works for decks too large for the API export call.
 */
@Component
@Order(30)
public class AuthenticatedExportUrlStrategy implements AcquisitionStrategy {

    private final StructuredStoreClient storeClient;
    private final String exportUrlTemplate;

    public AuthenticatedExportUrlStrategy(StructuredStoreClient storeClient,
                                          @Value("${app.drive.export-url-template:https://docs.google.com/presentation/d/%s/export/pptx}") String exportUrlTemplate) {
        this.storeClient = storeClient;
        this.exportUrlTemplate = exportUrlTemplate;
    }

    @Override
    public String name() {
        return "authenticated-export-url";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) {
        String url = entry.getExportUrl();
        if (url == null && entry.getExternalId() != null && entry.getSlotType().isDeck()) {
            url = String.format(exportUrlTemplate, entry.getExternalId());
        }
        if (url == null) {
            return Optional.empty();
        }
        long size = storeClient.fetchAuthenticated(url, target);
        return Optional.of(new DownloadedAsset(target, size, MimeTypes.defaultFor(entry.getSlotType()), null, name()));
    }
}
