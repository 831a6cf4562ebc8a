package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.AssetSourceFields;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.ResolutionState;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AssetEntryBuilderTest {

    private final AssetEntryBuilder builder = new AssetEntryBuilder();

    @Test
    void buildsOneUnresolvedEntryPerPopulatedField() {
        List<AssetEntry> entries = builder.build(AssetSourceFields.builder()
                .presentationSlidesUrl("https://docs.google.com/presentation/d/DECK1/edit")
                .recapSlidesUrl("https://docs.google.com/presentation/d/RECAP1/edit")
                .driveLink("https://drive.google.com/drive/folders/FOLDER1")
                .videoYoutubeUrl("https://youtu.be/VIDEO1")
                .build());

        assertThat(entries).extracting(AssetEntry::getSlotType)
                .containsExactly(SlotType.PRIMARY_DECK, SlotType.RECAP_DECK, SlotType.FOLDER_LINK, SlotType.VIDEO_LINK);
        assertThat(entries).extracting(AssetEntry::getExternalId)
                .containsExactly("DECK1", "RECAP1", "FOLDER1", "VIDEO1");
        assertThat(entries).allSatisfy(entry -> {
            assertThat(entry.getResolutionState()).isEqualTo(ResolutionState.UNRESOLVED);
            assertThat(entry.getAccessUrl()).isNull();
            assertThat(entry.getResolvedLocation()).isNull();
        });

        AssetEntry deck = entries.get(0);
        assertThat(deck.getSourceKind()).isEqualTo(SourceKind.STRUCTURED_STORE);
        assertThat(deck.getMimeType()).isEqualTo(MimeTypes.PPTX);
        assertThat(deck.getDisplayName()).isEqualTo("Presentation Slides");
        assertThat(deck.getContentType()).isEqualTo("presentation");
        assertThat(deck.getExternalReference()).isEqualTo("https://docs.google.com/presentation/d/DECK1/edit");

        AssetEntry folder = entries.get(2);
        assertThat(folder.getMimeType()).isEqualTo(MimeTypes.NATIVE_FOLDER);
        assertThat(folder.getDisplayName()).isEqualTo("Drive Folder");

        AssetEntry video = entries.get(3);
        assertThat(video.getSourceKind()).isEqualTo(SourceKind.EXTERNAL_VIDEO);
        assertThat(video.getMimeType()).isEqualTo(MimeTypes.EXTERNAL_VIDEO);
        assertThat(video.getDisplayName()).isEqualTo("YouTube Video");
    }

    @Test
    void knownPrimaryIdWinsOverExtraction() {
        List<AssetEntry> entries = builder.build(AssetSourceFields.builder()
                .presentationSlidesUrl("https://docs.google.com/presentation/d/FROM_URL/edit")
                .primaryDeckFileId("KNOWN_ID")
                .build());

        assertThat(entries).singleElement().extracting(AssetEntry::getExternalId).isEqualTo("KNOWN_ID");
    }

    @Test
    void skipsBlankFieldsAndUsesVideoTitle() {
        List<AssetEntry> entries = builder.build(AssetSourceFields.builder()
                .presentationSlidesUrl("  ")
                .videoYoutubeUrl("https://www.youtube.com/watch?v=VID9")
                .videoTitle("Opening Keynote")
                .build());

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.getSlotType()).isEqualTo(SlotType.VIDEO_LINK);
            assertThat(entry.getExternalId()).isEqualTo("VID9");
            assertThat(entry.getDisplayName()).isEqualTo("Opening Keynote");
        });
    }

    @Test
    void unparseableUrlLeavesIdEmpty() {
        List<AssetEntry> entries = builder.build(AssetSourceFields.builder()
                .recapSlidesUrl("https://example.com/slides.pptx")
                .build());

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.getExternalId()).isNull();
            assertThat(entry.getExternalReference()).isEqualTo("https://example.com/slides.pptx");
        });
    }
}
