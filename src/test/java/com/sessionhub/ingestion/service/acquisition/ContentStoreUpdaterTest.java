package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.ContentRecord;
import com.sessionhub.ingestion.model.ProcessingState;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.repository.ContentRecordRepository;
import com.sessionhub.ingestion.service.RecordPersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContentStoreUpdaterTest {

    private static final UUID CONTENT_ID = UUID.randomUUID();

    @Mock
    private ContentRecordRepository contentRecordRepository;

    @InjectMocks
    private ContentStoreUpdater updater;

    @Test
    void replacesDeckEntryAndRefreshesLegacyUrl() {
        ContentRecord record = record(
                AssetEntry.builder().slotType(SlotType.PRIMARY_DECK).externalId("DECK1")
                        .resolutionState(ResolutionState.UNRESOLVED).build(),
                AssetEntry.builder().slotType(SlotType.VIDEO_LINK).externalId("V1").build());
        record.setPresentationSlidesUrl("https://docs.google.com/presentation/d/DECK1/edit");
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.of(record));

        boolean saved = updater.merge(CONTENT_ID, resolved(SlotType.PRIMARY_DECK, "https://signed/deck"));

        assertThat(saved).isTrue();
        assertThat(record.getFileUrls()).hasSize(2);
        assertThat(record.getFileUrls().get(0).getResolvedLocation()).isEqualTo("s3://bucket/sessions/deck.pptx");
        assertThat(record.getFileUrls().get(1).getSlotType()).isEqualTo(SlotType.VIDEO_LINK);
        assertThat(record.getPresentationSlidesUrl()).isEqualTo("https://signed/deck");
        assertThat(record.getRecapSlidesUrl()).isNull();
        assertThat(record.getProcessingState()).isEqualTo(ProcessingState.READY);
        verify(contentRecordRepository).save(record);
    }

    @Test
    void secondIdenticalMergeWritesNothing() {
        ContentRecord record = record(AssetEntry.builder().slotType(SlotType.PRIMARY_DECK).externalId("DECK1").build());
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.of(record));
        AssetEntry resolved = resolved(SlotType.PRIMARY_DECK, "https://signed/deck");

        assertThat(updater.merge(CONTENT_ID, resolved)).isTrue();
        assertThat(updater.merge(CONTENT_ID, resolved)).isFalse();

        verify(contentRecordRepository, times(1)).save(any(ContentRecord.class));
    }

    @Test
    void recapResolutionLeavesPrimaryUrlAlone() {
        ContentRecord record = record(
                AssetEntry.builder().slotType(SlotType.PRIMARY_DECK).externalId("DECK1").build(),
                AssetEntry.builder().slotType(SlotType.RECAP_DECK).externalId("RECAP1").build());
        record.setPresentationSlidesUrl("https://docs.google.com/presentation/d/DECK1/edit");
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.of(record));

        updater.merge(CONTENT_ID, resolved(SlotType.RECAP_DECK, "https://signed/recap"));

        assertThat(record.getRecapSlidesUrl()).isEqualTo("https://signed/recap");
        assertThat(record.getPresentationSlidesUrl()).isEqualTo("https://docs.google.com/presentation/d/DECK1/edit");
        assertThat(record.getProcessingState()).isEqualTo(ProcessingState.ACQUISITION_PENDING);
    }

    @Test
    void appendsEntryForMissingSlotWithoutTouchingDeckUrls() {
        ContentRecord record = record();
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.of(record));
        AssetEntry folder = AssetEntry.builder().slotType(SlotType.FOLDER_LINK).externalId("F1")
                .accessUrl("https://drive.google.com/drive/folders/F1").build();

        updater.merge(CONTENT_ID, folder);

        assertThat(record.getFileUrls()).containsExactly(folder);
        assertThat(record.getPresentationSlidesUrl()).isNull();
        assertThat(record.getRecapSlidesUrl()).isNull();
    }

    @Test
    void markFailedKeepsEntryUnresolvedWithError() {
        AssetEntry deck = AssetEntry.builder().slotType(SlotType.PRIMARY_DECK).externalId("DECK1")
                .exportUrl("https://export/DECK1").build();
        ContentRecord record = record(deck);
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.of(record));

        boolean saved = updater.markFailed(CONTENT_ID, deck, "404 Not Found");

        assertThat(saved).isTrue();
        AssetEntry stored = record.getFileUrls().get(0);
        assertThat(stored.getResolutionState()).isEqualTo(ResolutionState.FAILED);
        assertThat(stored.getResolvedLocation()).isNull();
        assertThat(stored.getAcquisitionError()).isEqualTo("404 Not Found");
        assertThat(stored.getExportUrl()).isEqualTo("https://export/DECK1");
        assertThat(record.getProcessingState()).isEqualTo(ProcessingState.ACQUISITION_FAILED);
    }

    @Test
    void missingRecordIsReported() {
        when(contentRecordRepository.findByIdForUpdate(CONTENT_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> updater.merge(CONTENT_ID, resolved(SlotType.PRIMARY_DECK, "https://signed/deck")))
                .isInstanceOf(RecordPersistenceException.class)
                .hasMessageContaining(CONTENT_ID.toString());
        verify(contentRecordRepository, never()).save(any());
    }

    private static ContentRecord record(AssetEntry... entries) {
        return ContentRecord.builder()
                .id(CONTENT_ID)
                .title("Session")
                .sessionId("S-1")
                .fileUrls(new ArrayList<>(List.of(entries)))
                .processingState(ProcessingState.ACQUISITION_PENDING)
                .build();
    }

    private static AssetEntry resolved(SlotType slot, String url) {
        String file = slot == SlotType.PRIMARY_DECK ? "deck" : "recap";
        return AssetEntry.builder()
                .slotType(slot)
                .externalId(slot == SlotType.PRIMARY_DECK ? "DECK1" : "RECAP1")
                .resolvedLocation("s3://bucket/sessions/" + file + ".pptx")
                .accessUrl(url)
                .resolutionState(ResolutionState.RESOLVED)
                .byteSize(1024L)
                .build();
    }
}
