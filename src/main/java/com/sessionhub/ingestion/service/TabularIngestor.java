package com.sessionhub.ingestion.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.AssetSourceFields;
import com.sessionhub.ingestion.model.BatchJob;
import com.sessionhub.ingestion.model.CellValue;
import com.sessionhub.ingestion.model.ContentRecord;
import com.sessionhub.ingestion.model.IngestionReport;
import com.sessionhub.ingestion.model.ParsedTable;
import com.sessionhub.ingestion.model.Presenter;
import com.sessionhub.ingestion.model.ProcessingState;
import com.sessionhub.ingestion.model.RowError;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.repository.ContentRecordRepository;
import com.sessionhub.ingestion.service.acquisition.AcquisitionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sequential row loop of a bulk upload. Each row becomes one content record; a failing row is
 * recorded as a row error and the loop moves on.
 */
@Service
public class TabularIngestor {

    private static final Logger logger = LoggerFactory.getLogger(TabularIngestor.class);

    public static final String COL_TITLE = "title";
    public static final String COL_SESSION_ID = "sessionId";
    public static final List<String> REQUIRED_COLUMNS = List.of(COL_TITLE, COL_SESSION_ID);

    static final String COL_DESCRIPTION = "description";
    static final String COL_ABSTRACT = "abstract";
    static final String COL_PRESENTATION_SLIDES_URL = "presentationSlidesUrl";
    static final String COL_RECAP_SLIDES_URL = "recapSlidesUrl";
    static final String COL_DRIVE_LINK = "driveLink";
    static final String COL_VIDEO_URL = "videoYoutubeUrl";
    static final String COL_DRIVE_FILE_ID = "driveFileId";
    static final String COL_VIDEO_TITLE = "ytVideoTitle";
    static final String COL_FILE_URLS = "fileUrls";
    static final String COL_PRESENTERS = "presenters";
    static final int PRESENTER_SLOTS = 6;

    // Root-level row fields copied into the record's metadata map.
    static final List<String> METADATA_COLUMNS = List.of(
            "abstract", "status", "track", "sessionType", "demoType", "sessionDate", "durationMinutes",
            "learningLevel", "topic", "topics", "industry", "videoRecordingStatus", "videoSourceFileUrl",
            "youtubeChannel", "youtubeVisibility", "ytVideoTitle", "ytDescription", "jobRole", "targetJobRoles");

    private static final int PROGRESS_LOG_INTERVAL = 10;

    private final CellValueParser cellValueParser;
    private final AssetEntryBuilder assetEntryBuilder;
    private final AssetEntryDeduplicator deduplicator;
    private final ContentRecordRepository contentRecordRepository;
    private final BatchJobService batchJobService;
    private final AcquisitionScheduler acquisitionScheduler;

    public TabularIngestor(CellValueParser cellValueParser,
                           AssetEntryBuilder assetEntryBuilder,
                           AssetEntryDeduplicator deduplicator,
                           ContentRecordRepository contentRecordRepository,
                           BatchJobService batchJobService,
                           AcquisitionScheduler acquisitionScheduler) {
        this.cellValueParser = cellValueParser;
        this.assetEntryBuilder = assetEntryBuilder;
        this.deduplicator = deduplicator;
        this.contentRecordRepository = contentRecordRepository;
        this.batchJobService = batchJobService;
        this.acquisitionScheduler = acquisitionScheduler;
    }

    /**
     * Ingests every row of the table into the given job. Acquisition requests found along the way
     * are returned, not dispatched.
     */
    public IngestionReport ingest(ParsedTable table, BatchJob job) {
        List<UUID> created = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        List<AcquisitionRequest> requests = new ArrayList<>();
        int successful = 0;
        int failed = 0;

        List<Map<String, String>> rows = table.rows();
        for (int index = 0; index < rows.size(); index++) {
            Map<String, String> row = rows.get(index);
            RowError rowError = null;
            try {
                ContentRecord record = buildRecord(row, job.getId());
                ContentRecord saved = persist(record);
                created.add(saved.getId());
                requests.addAll(acquisitionScheduler.collectRequests(saved));
                successful++;
            } catch (Exception e) {
                failed++;
                rowError = new RowError(index, e.getMessage(), snapshot(row));
                errors.add(rowError);
                logger.warn("Row {} of job {} failed: {}", index, job.getId(), e.getMessage());
            }
            recordProgress(job, rowError);

            int processed = index + 1;
            if (processed % PROGRESS_LOG_INTERVAL == 0) {
                logger.info("Job {}: processed {}/{} rows ({} ok, {} failed)",
                        job.getId(), processed, rows.size(), successful, failed);
            }
        }
        return new IngestionReport(rows.size(), successful, failed, created, errors, requests);
    }

    /**
     * Builds the unsaved record for one row.
     *
     * @throws IllegalArgumentException if the title or session id cell is empty
     */
    public ContentRecord buildRecord(Map<String, String> row, UUID batchJobId) {
        String title = text(row, COL_TITLE);
        String sessionId = text(row, COL_SESSION_ID);
        if (title == null) {
            throw new IllegalArgumentException("Missing required value: " + COL_TITLE);
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("Missing required value: " + COL_SESSION_ID);
        }

        String description = text(row, COL_DESCRIPTION);
        if (description == null) {
            description = text(row, COL_ABSTRACT);
        }

        List<AssetEntry> entries = buildEntries(row);

        return ContentRecord.builder()
                .title(title)
                .sessionId(sessionId)
                .description(description)
                .status(text(row, "status"))
                .track(text(row, "track"))
                .sessionType(text(row, "sessionType"))
                .learningLevel(text(row, "learningLevel"))
                .topic(text(row, "topic"))
                .industry(text(row, "industry"))
                .topics(cellValueParser.parseStringList(row.get("topics")))
                .tags(cellValueParser.parseStringList(row.get("tags")))
                .jobRoles(cellValueParser.parseStringList(row.get("jobRoles")))
                .areasOfInterest(cellValueParser.parseStringList(row.get("areasOfInterest")))
                .presenters(buildPresenters(row))
                .fileUrls(entries)
                .presentationSlidesUrl(text(row, COL_PRESENTATION_SLIDES_URL))
                .recapSlidesUrl(text(row, COL_RECAP_SLIDES_URL))
                .driveLink(text(row, COL_DRIVE_LINK))
                .videoYoutubeUrl(text(row, COL_VIDEO_URL))
                .metadata(buildMetadata(row))
                .batchJobId(batchJobId)
                .processingState(ProcessingState.of(entries))
                .build();
    }

    private List<AssetEntry> buildEntries(Map<String, String> row) {
        List<AssetEntry> built = assetEntryBuilder.build(AssetSourceFields.builder()
                .presentationSlidesUrl(text(row, COL_PRESENTATION_SLIDES_URL))
                .recapSlidesUrl(text(row, COL_RECAP_SLIDES_URL))
                .driveLink(text(row, COL_DRIVE_LINK))
                .videoYoutubeUrl(text(row, COL_VIDEO_URL))
                .primaryDeckFileId(text(row, COL_DRIVE_FILE_ID))
                .videoTitle(text(row, COL_VIDEO_TITLE))
                .build());

        Map<SlotType, List<AssetEntry>> candidates = new EnumMap<>(SlotType.class);
        for (AssetEntry entry : built) {
            candidates.computeIfAbsent(entry.getSlotType(), slot -> new ArrayList<>()).add(entry);
        }
        List<AssetEntry> earlier = cellValueParser.parseObjectList(row.get(COL_FILE_URLS),
                new TypeReference<List<AssetEntry>>() { });
        for (AssetEntry entry : earlier) {
            if (entry != null && entry.getSlotType() != null) {
                candidates.computeIfAbsent(entry.getSlotType(), slot -> new ArrayList<>()).add(entry);
            }
        }
        return deduplicator.merge(candidates);
    }

    private List<Presenter> buildPresenters(Map<String, String> row) {
        List<Presenter> presenters = new ArrayList<>();
        for (int i = 1; i <= PRESENTER_SLOTS; i++) {
            String fullName = text(row, "presenterFullName" + i);
            if (fullName == null) {
                continue;
            }
            presenters.add(Presenter.builder()
                    .fullName(fullName)
                    .jobTitle(text(row, "presenterJobTitle" + i))
                    .company(text(row, "presenterCompany" + i))
                    .industry(text(row, "presenterIndustry" + i))
                    .build());
        }
        if (presenters.isEmpty()) {
            for (Presenter presenter : cellValueParser.parseObjectList(row.get(COL_PRESENTERS),
                    new TypeReference<List<Presenter>>() { })) {
                if (presenter != null && presenter.getFullName() != null && !presenter.getFullName().isBlank()) {
                    presenters.add(presenter);
                }
            }
        }
        return presenters;
    }

    private Map<String, Object> buildMetadata(Map<String, String> row) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (String column : METADATA_COLUMNS) {
            CellValue value = cellValueParser.parse(row.get(column));
            if (!value.isNull()) {
                metadata.put(column, value.toPlainValue());
            }
        }
        return metadata;
    }

    private ContentRecord persist(ContentRecord record) {
        try {
            return contentRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Could not save content record for session " + record.getSessionId(), e);
        }
    }

    /**
     * Counters live on the caller's job instance; a failed progress write is logged and the loop goes on.
     */
    private void recordProgress(BatchJob job, RowError rowError) {
        try {
            if (rowError == null) {
                batchJobService.recordRowSuccess(job);
            } else {
                batchJobService.recordRowFailure(job, rowError);
            }
        } catch (RecordPersistenceException e) {
            logger.error("Could not update progress of job {}", job.getId(), e);
        }
    }

    private static Map<String, Object> snapshot(Map<String, String> row) {
        return new LinkedHashMap<>(row);
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
