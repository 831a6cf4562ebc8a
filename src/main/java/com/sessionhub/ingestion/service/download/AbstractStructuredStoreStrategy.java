package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.SourceKind;
import com.sessionhub.ingestion.model.StoreFileMetadata;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Shared fetch-by-id flow: native documents are exported to pptx, anything else is downloaded as is.
 */
public abstract class AbstractStructuredStoreStrategy implements AcquisitionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AbstractStructuredStoreStrategy.class);

    protected final StructuredStoreClient storeClient;

    protected AbstractStructuredStoreStrategy(StructuredStoreClient storeClient) {
        this.storeClient = storeClient;
    }

    protected boolean isStructuredStoreEntry(AssetEntry entry) {
        return entry.getSourceKind() == null || entry.getSourceKind() == SourceKind.STRUCTURED_STORE;
    }

    protected Optional<DownloadedAsset> fetchById(String fileId, AssetEntry entry, Path target) {
        StoreFileMetadata metadata = storeClient.getMetadata(fileId);
        if (metadata == null) {
            throw new AcquisitionStrategyException("No metadata returned for file " + fileId);
        }
        long size;
        String mimeType;
        if (metadata.isNativeFormat()) {
            if (!entry.getSlotType().isDeck()) {
                throw new AcquisitionStrategyException("Native file " + fileId + " of type "
                        + metadata.mimeType() + " cannot be exported for slot " + entry.getSlotType());
            }
            logger.debug("Exporting native file {} as pptx", fileId);
            size = storeClient.exportFile(fileId, MimeTypes.PPTX, target);
            mimeType = MimeTypes.PPTX;
        } else {
            logger.debug("Downloading media of file {} ({})", fileId, metadata.mimeType());
            size = storeClient.downloadFile(fileId, target);
            mimeType = metadata.mimeType() != null ? metadata.mimeType() : MimeTypes.OCTET_STREAM;
        }
        return Optional.of(new DownloadedAsset(target, size, mimeType, metadata.name(), name()));
    }
}
