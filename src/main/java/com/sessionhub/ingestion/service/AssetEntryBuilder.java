package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.AssetSourceFields;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.model.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the typed asset entries of a row from its legacy URL columns.
 */
@Component
public class AssetEntryBuilder {

    /**
     * Returns one unresolved entry per populated URL field, in slot order.
     */
    public List<AssetEntry> build(AssetSourceFields fields) {
        List<AssetEntry> entries = new ArrayList<>(4);
        addIfPresent(entries, SlotType.PRIMARY_DECK, fields.getPresentationSlidesUrl(),
                fields.getPrimaryDeckFileId(), null);
        addIfPresent(entries, SlotType.RECAP_DECK, fields.getRecapSlidesUrl(), null, null);
        addIfPresent(entries, SlotType.FOLDER_LINK, fields.getDriveLink(), null, null);
        addIfPresent(entries, SlotType.VIDEO_LINK, fields.getVideoYoutubeUrl(), null, fields.getVideoTitle());
        return entries;
    }

    private void addIfPresent(List<AssetEntry> entries, SlotType slotType, String url, String knownId, String title) {
        if (isBlank(url)) {
            return;
        }
        String reference = url.trim();
        boolean video = slotType == SlotType.VIDEO_LINK;
        String externalId = !isBlank(knownId)
                ? knownId.trim()
                : (video ? IdentifierExtractor.extractVideoId(reference)
                         : IdentifierExtractor.extractStructuredStoreId(reference));

        entries.add(AssetEntry.builder()
                .slotType(slotType)
                .contentType(slotType.getContentType())
                .displayName(isBlank(title) ? slotType.getDefaultDisplayName() : title.trim())
                .sourceKind(video ? SourceKind.EXTERNAL_VIDEO : SourceKind.STRUCTURED_STORE)
                .externalReference(reference)
                .externalId(externalId)
                .mimeType(MimeTypes.defaultFor(slotType))
                .resolutionState(ResolutionState.UNRESOLVED)
                .accessUrl(null)
                .build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
