package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.ContentRecord;
import com.sessionhub.ingestion.model.ProcessingState;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.repository.ContentRecordRepository;
import com.sessionhub.ingestion.service.RecordPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes acquisition outcomes back into the owning content record.
 */
@Service
public class ContentStoreUpdater {

    private static final Logger logger = LoggerFactory.getLogger(ContentStoreUpdater.class);

    private final ContentRecordRepository contentRecordRepository;

    public ContentStoreUpdater(ContentRecordRepository contentRecordRepository) {
        this.contentRecordRepository = contentRecordRepository;
    }

    /**
     * Replaces (or appends) the entry for the resolved entry's slot and refreshes the legacy
     * deck URL. Writes nothing when the record already holds exactly this state.
     *
     * @return true if the record was saved
     */
    @Transactional
    public boolean merge(UUID contentId, AssetEntry resolvedEntry) {
        ContentRecord record = load(contentId);
        boolean changed = replaceEntry(record, resolvedEntry);

        String url = resolvedEntry.getAccessUrl();
        if (url != null) {
            if (resolvedEntry.getSlotType() == SlotType.PRIMARY_DECK
                    && !url.equals(record.getPresentationSlidesUrl())) {
                record.setPresentationSlidesUrl(url);
                changed = true;
            } else if (resolvedEntry.getSlotType() == SlotType.RECAP_DECK
                    && !url.equals(record.getRecapSlidesUrl())) {
                record.setRecapSlidesUrl(url);
                changed = true;
            }
        }
        return saveIfChanged(record, changed);
    }

    /**
     * Records an exhausted acquisition: the entry stays unresolved, is marked FAILED and
     * carries the last error.
     */
    @Transactional
    public boolean markFailed(UUID contentId, AssetEntry entry, String error) {
        AssetEntry failed = entry.toBuilder()
                .resolvedLocation(null)
                .resolutionState(ResolutionState.FAILED)
                .acquisitionError(error)
                .build();
        ContentRecord record = load(contentId);
        boolean changed = replaceEntry(record, failed);
        return saveIfChanged(record, changed);
    }

    private ContentRecord load(UUID contentId) {
        try {
            return contentRecordRepository.findByIdForUpdate(contentId)
                    .orElseThrow(() -> new RecordPersistenceException("Content record not found: " + contentId));
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Could not load content record " + contentId, e);
        }
    }

    private boolean replaceEntry(ContentRecord record, AssetEntry entry) {
        List<AssetEntry> entries = record.getFileUrls() == null
                ? new ArrayList<>()
                : new ArrayList<>(record.getFileUrls());
        int index = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getSlotType() == entry.getSlotType()) {
                index = i;
                break;
            }
        }
        if (index >= 0) {
            if (Objects.equals(entries.get(index), entry)) {
                return false;
            }
            entries.set(index, entry);
        } else {
            entries.add(entry);
        }
        record.setFileUrls(entries);
        return true;
    }

    private boolean saveIfChanged(ContentRecord record, boolean changed) {
        ProcessingState state = ProcessingState.of(record.getFileUrls());
        if (state != record.getProcessingState()) {
            record.setProcessingState(state);
            changed = true;
        }
        if (!changed) {
            logger.debug("Content record {} already up to date; skipping write", record.getId());
            return false;
        }
        try {
            contentRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Could not save content record " + record.getId(), e);
        }
        logger.info("Updated content record {} (state {})", record.getId(), state);
        return true;
    }
}
