package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collapses the candidate entries of each slot into one canonical entry.
 *
 * <p>Candidates are ranked: resolved stored copy first, then anything that has or can synthesize an
 * export link, then a bare URL. Within a rank the more complete entry wins and remaining ties
 * are broken on field values, so the outcome never depends on the order candidates arrive in.</p>
 */
@Component
public class AssetEntryDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(AssetEntryDeduplicator.class);

    private static final Comparator<AssetEntry> FIELD_ORDER = Stream.<Function<AssetEntry, String>>of(
                    AssetEntry::getResolvedLocation,
                    AssetEntry::getExportUrl,
                    AssetEntry::getAccessUrl,
                    AssetEntry::getExternalId,
                    AssetEntry::getExternalReference,
                    AssetEntry::getDisplayName,
                    AssetEntry::getMimeType,
                    AssetEntry::getContentType,
                    AssetEntry::getThumbnailLink,
                    AssetEntry::getWebViewLink,
                    AssetEntry::getIconLink,
                    AssetEntry::getAcquisitionError,
                    entry -> Objects.toString(entry.getByteSize(), null),
                    entry -> Objects.toString(entry.getTooLargeToExport(), null),
                    entry -> Objects.toString(entry.getResolutionState(), null),
                    entry -> Objects.toString(entry.getSourceKind(), null))
            .map(key -> Comparator.comparing(key, Comparator.nullsLast(Comparator.<String>naturalOrder())))
            .reduce((first, second) -> first.thenComparing(second))
            .orElseThrow();

    private static final Comparator<AssetEntry> PRIORITY = Comparator
            .comparingInt(AssetEntryDeduplicator::rank)
            .thenComparing(Comparator.comparingInt(AssetEntryDeduplicator::completeness).reversed())
            .thenComparing(FIELD_ORDER);

    private final String exportUrlTemplate;

    public AssetEntryDeduplicator(
            @Value("${app.drive.export-url-template:https://docs.google.com/presentation/d/%s/export/pptx}") String exportUrlTemplate) {
        this.exportUrlTemplate = exportUrlTemplate;
    }

    /**
     * Merges candidates per slot and returns at most one entry per slot, in slot order.
     */
    public List<AssetEntry> merge(Map<SlotType, List<AssetEntry>> candidatesBySlot) {
        List<AssetEntry> merged = new ArrayList<>();
        for (SlotType slot : SlotType.values()) {
            List<AssetEntry> candidates = candidatesBySlot.get(slot);
            if (candidates == null) {
                continue;
            }
            List<AssetEntry> ranked = candidates.stream()
                    .filter(Objects::nonNull)
                    .sorted(PRIORITY)
                    .collect(Collectors.toList());
            if (ranked.isEmpty()) {
                continue;
            }
            merged.add(finish(slot, ranked));
        }
        return merged;
    }

    /**
     * Groups a flat list by slot and merges it. Entries without a slot are dropped.
     */
    public List<AssetEntry> mergeAll(Collection<AssetEntry> entries) {
        Map<SlotType, List<AssetEntry>> bySlot = entries.stream()
                .filter(entry -> entry != null && entry.getSlotType() != null)
                .collect(Collectors.groupingBy(AssetEntry::getSlotType));
        return merge(bySlot);
    }

    private AssetEntry finish(SlotType slot, List<AssetEntry> ranked) {
        AssetEntry winner = ranked.get(0).toBuilder().build();
        winner.setSlotType(slot);

        if (winner.getAccessUrl() == null) {
            ranked.stream()
                    .skip(1)
                    .map(AssetEntry::getAccessUrl)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .ifPresent(winner::setAccessUrl);
        }
        if (winner.getAccessUrl() == null && winner.getExportUrl() != null) {
            winner.setAccessUrl(winner.getExportUrl());
        }

        fillDefaults(slot, winner);

        winner.setIconLink(null);
        if (winner.getWebViewLink() != null) {
            if (winner.getExternalReference() == null) {
                winner.setExternalReference(winner.getWebViewLink());
            }
            winner.setWebViewLink(null);
        }

        winner.setResolutionState(winner.inferResolutionState());
        if (winner.getResolvedLocation() != null) {
            winner.setTooLargeToExport(null);
        } else if (Boolean.TRUE.equals(winner.getTooLargeToExport())
                && winner.getResolutionState() == ResolutionState.UNRESOLVED) {
            winner.setResolutionState(ResolutionState.TOO_LARGE);
        }

        if (slot.isDeck() && winner.getResolvedLocation() == null && winner.getExternalId() != null
                && (winner.getAccessUrl() == null || (winner.isFlaggedTooLarge() && winner.getExportUrl() == null))) {
            String exportUrl = String.format(exportUrlTemplate, winner.getExternalId());
            winner.setExportUrl(exportUrl);
            winner.setAccessUrl(exportUrl);
        }

        if (winner.getResolvedLocation() == null && winner.isFlaggedTooLarge() && winner.getAccessUrl() == null) {
            if (winner.getExternalReference() != null) {
                winner.setAccessUrl(winner.getExternalReference());
            } else {
                logger.warn("Entry for slot {} is flagged too large but has no usable link; marking unresolved", slot);
                if (winner.getResolutionState() == ResolutionState.TOO_LARGE) {
                    winner.setResolutionState(ResolutionState.UNRESOLVED);
                }
                winner.setTooLargeToExport(null);
            }
        }
        return winner;
    }

    private void fillDefaults(SlotType slot, AssetEntry entry) {
        if (entry.getContentType() == null) {
            entry.setContentType(slot.getContentType());
        }
        if (entry.getDisplayName() == null || entry.getDisplayName().isBlank()) {
            entry.setDisplayName(slot.getDefaultDisplayName());
        }
        if (entry.getSourceKind() == null) {
            entry.setSourceKind(slot == SlotType.VIDEO_LINK ? SourceKind.EXTERNAL_VIDEO : SourceKind.STRUCTURED_STORE);
        }
        if (entry.getMimeType() == null) {
            entry.setMimeType(MimeTypes.defaultFor(slot));
        }
    }

    private static int rank(AssetEntry entry) {
        if (entry.getResolvedLocation() != null && entry.inferResolutionState() == ResolutionState.RESOLVED) {
            return 0;
        }
        boolean deck = entry.getSlotType() != null && entry.getSlotType().isDeck();
        if (entry.getExportUrl() != null || (deck && entry.getExternalId() != null)) {
            return 1;
        }
        if (entry.getAccessUrl() != null) {
            return 2;
        }
        return 3;
    }

    private static int completeness(AssetEntry entry) {
        int score = 0;
        for (Object field : new Object[]{
                entry.getExternalId(), entry.getExternalReference(), entry.getAccessUrl(),
                entry.getExportUrl(), entry.getMimeType(), entry.getByteSize(),
                entry.getThumbnailLink(), entry.getDisplayName()}) {
            if (field != null) {
                score++;
            }
        }
        return score;
    }
}
