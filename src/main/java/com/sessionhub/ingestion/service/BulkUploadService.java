package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.BatchJob;
import com.sessionhub.ingestion.model.IngestionReport;
import com.sessionhub.ingestion.model.ParsedTable;
import com.sessionhub.ingestion.service.acquisition.AcquisitionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for a bulk upload: validate, create the job, run the row loop, then hand the
 * collected acquisition work to the scheduler.
 */
@Service
public class BulkUploadService {

    private static final Logger logger = LoggerFactory.getLogger(BulkUploadService.class);

    private final TabularReader tabularReader;
    private final TabularIngestor tabularIngestor;
    private final BatchJobService batchJobService;
    private final AcquisitionScheduler acquisitionScheduler;

    public BulkUploadService(TabularReader tabularReader,
                             TabularIngestor tabularIngestor,
                             BatchJobService batchJobService,
                             AcquisitionScheduler acquisitionScheduler) {
        this.tabularReader = tabularReader;
        this.tabularIngestor = tabularIngestor;
        this.batchJobService = batchJobService;
        this.acquisitionScheduler = acquisitionScheduler;
    }

    /**
     * Processes one uploaded file and returns the finished job.
     *
     * @throws BatchValidationException if the file is unreadable, lacks a required column or has no data rows;
     *                                  no job exists in that case
     * @throws RecordPersistenceException if the job itself cannot be created
     */
    public BatchJob submit(byte[] content, String filename, String createdBy) {
        ParsedTable table = tabularReader.read(content, filename);
        validate(table, filename);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("filename", filename);
        metadata.put("totalRows", table.size());
        BatchJob job = batchJobService.create(BatchJobService.JOB_TYPE_BULK_UPLOAD, table.size(), metadata, createdBy);
        batchJobService.markProcessing(job);

        IngestionReport report;
        try {
            report = tabularIngestor.ingest(table, job);
        } catch (RuntimeException e) {
            batchJobService.markFailed(job, "Row processing aborted: " + e.getMessage());
            throw e;
        }
        batchJobService.markCompleted(job);
        logger.info("Upload {} produced {} records and {} acquisition request(s)",
                filename, report.createdRecordIds().size(), report.acquisitionRequests().size());

        acquisitionScheduler.schedule(report.acquisitionRequests());
        return job;
    }

    private void validate(ParsedTable table, String filename) {
        List<String> missing = TabularIngestor.REQUIRED_COLUMNS.stream()
                .filter(column -> !table.hasColumn(column))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new BatchValidationException("Missing required columns in " + filename + ": " + String.join(", ", missing));
        }
        if (table.size() == 0) {
            throw new BatchValidationException("No data rows in " + filename);
        }
    }
}
