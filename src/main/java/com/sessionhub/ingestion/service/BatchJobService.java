package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.BatchJob;
import com.sessionhub.ingestion.model.BatchJobStatus;
import com.sessionhub.ingestion.model.RowError;
import com.sessionhub.ingestion.repository.BatchJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks the lifecycle and counters of bulk upload jobs.
 */
@Service
public class BatchJobService {

    private static final Logger logger = LoggerFactory.getLogger(BatchJobService.class);

    public static final String JOB_TYPE_BULK_UPLOAD = "bulk_upload";

    private final BatchJobRepository batchJobRepository;

    public BatchJobService(BatchJobRepository batchJobRepository) {
        this.batchJobRepository = batchJobRepository;
    }

    /**
     * Creates a PENDING job. Failure here is fatal for the upload.
     */
    public BatchJob create(String jobType, int totalItems, Map<String, Object> metadata, String createdBy) {
        BatchJob job = BatchJob.builder()
                .status(BatchJobStatus.PENDING)
                .jobType(jobType)
                .totalItems(totalItems)
                .metadata(metadata)
                .createdBy(createdBy)
                .errors(new ArrayList<>())
                .build();
        BatchJob saved = save(job);
        logger.info("Created batch job {} of type {} with {} items", saved.getId(), jobType, totalItems);
        return saved;
    }

    public BatchJob markProcessing(BatchJob job) {
        job.setStatus(BatchJobStatus.PROCESSING);
        return save(job);
    }

    /**
     * Counts one successfully ingested row.
     */
    public BatchJob recordRowSuccess(BatchJob job) {
        job.setProcessedItems(job.getProcessedItems() + 1);
        job.setSuccessfulItems(job.getSuccessfulItems() + 1);
        return save(job);
    }

    /**
     * Counts one failed row and keeps its error.
     */
    public BatchJob recordRowFailure(BatchJob job, RowError error) {
        job.setProcessedItems(job.getProcessedItems() + 1);
        job.setFailedItems(job.getFailedItems() + 1);
        if (job.getErrors() == null) {
            job.setErrors(new ArrayList<>());
        }
        job.getErrors().add(error);
        return save(job);
    }

    /**
     * Closes the job. It is FAILED only when rows were processed and none succeeded.
     */
    public BatchJob markCompleted(BatchJob job) {
        boolean nothingSucceeded = job.getProcessedItems() > 0 && job.getSuccessfulItems() == 0;
        job.setStatus(nothingSucceeded ? BatchJobStatus.FAILED : BatchJobStatus.COMPLETED);
        job.setCompletedAt(OffsetDateTime.now());
        BatchJob saved = save(job);
        logger.info("Batch job {} finished as {}: {} processed, {} successful, {} failed",
                job.getId(), job.getStatus(), job.getProcessedItems(), job.getSuccessfulItems(), job.getFailedItems());
        return saved;
    }

    /**
     * Closes the job as FAILED with a job-level error.
     */
    public BatchJob markFailed(BatchJob job, String message) {
        job.setStatus(BatchJobStatus.FAILED);
        job.setCompletedAt(OffsetDateTime.now());
        if (job.getErrors() == null) {
            job.setErrors(new ArrayList<>());
        }
        job.getErrors().add(new RowError(-1, message, null));
        logger.error("Batch job {} failed: {}", job.getId(), message);
        return save(job);
    }

    public Optional<BatchJob> getJob(UUID jobId) {
        return batchJobRepository.findById(jobId);
    }

    private BatchJob save(BatchJob job) {
        try {
            return batchJobRepository.save(job);
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Could not persist batch job " + job.getId(), e);
        }
    }
}
