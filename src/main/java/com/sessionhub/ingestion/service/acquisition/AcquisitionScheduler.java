package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AcquisitionKey;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AcquisitionResult;
import com.sessionhub.ingestion.model.AcquisitionTask;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.ContentRecord;
import com.sessionhub.ingestion.model.DispatchDecision;
import com.sessionhub.ingestion.service.queue.AcquisitionQueuePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds deck entries that need to be fetched and dispatches one background task per
 * (record, slot), never two at once for the same key.
 */
@Service
public class AcquisitionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AcquisitionScheduler.class);
    static final String DISPATCH_MODE_SQS = "sqs";

    private final AcquisitionTaskRegistry registry;
    private final AssetAcquisitionService acquisitionService;
    private final TaskExecutor taskExecutor;
    private final ObjectProvider<AcquisitionQueuePublisher> queuePublisher;
    private final boolean queueMode;

    public AcquisitionScheduler(AcquisitionTaskRegistry registry,
                                AssetAcquisitionService acquisitionService,
                                @Qualifier("acquisitionExecutor") TaskExecutor taskExecutor,
                                ObjectProvider<AcquisitionQueuePublisher> queuePublisher,
                                @Value("${app.acquisition.dispatch-mode:local}") String dispatchMode) {
        this.registry = registry;
        this.acquisitionService = acquisitionService;
        this.taskExecutor = taskExecutor;
        this.queuePublisher = queuePublisher;
        this.queueMode = DISPATCH_MODE_SQS.equalsIgnoreCase(dispatchMode);
    }

    /**
     * Requests for every deck entry of the record that is flagged too large or still lacks a stored copy.
     */
    public List<AcquisitionRequest> collectRequests(ContentRecord record) {
        List<AcquisitionRequest> requests = new ArrayList<>();
        if (record.getFileUrls() == null) {
            return requests;
        }
        for (AssetEntry entry : record.getFileUrls()) {
            if (entry.needsAcquisition()) {
                requests.add(new AcquisitionRequest(record.getId(), entry.getSlotType(), entry));
            }
        }
        return requests;
    }

    /**
     * Dispatches the requests. Duplicates of an in-flight key are dropped and reported as DEFERRED.
     *
     * @return one decision per request, in request order
     */
    public List<DispatchDecision> schedule(List<AcquisitionRequest> requests) {
        List<DispatchDecision> decisions = new ArrayList<>();
        if (requests == null || requests.isEmpty()) {
            return decisions;
        }
        AcquisitionQueuePublisher publisher = queueMode ? queuePublisher.getIfAvailable() : null;
        if (queueMode && publisher == null) {
            logger.warn("Queue dispatch mode is set but no queue publisher is available; dispatching locally");
        }
        for (AcquisitionRequest request : requests) {
            AcquisitionKey key = request.key();
            if (publisher != null) {
                if (registry.isInFlight(key)) {
                    decisions.add(DispatchDecision.DEFERRED);
                    continue;
                }
                publisher.publish(request);
                decisions.add(DispatchDecision.QUEUED);
                continue;
            }
            Optional<AcquisitionTask> task = registry.register(request);
            if (task.isEmpty()) {
                decisions.add(DispatchDecision.DEFERRED);
                continue;
            }
            dispatch(task.get());
            decisions.add(DispatchDecision.DISPATCHED);
        }
        logger.info("Scheduled {} acquisition request(s): {}", requests.size(), decisions);
        return decisions;
    }

    /**
     * Runs a registered task on the calling thread and retires it from the registry.
     */
    public AcquisitionResult runTask(AcquisitionTask task) {
        task.start();
        try {
            AcquisitionResult result = acquisitionService.acquire(task.getRequest());
            if (result.isResolved()) {
                task.succeed(result.attempts());
            } else {
                task.fail(result.attempts(), result.error());
                logger.warn("Acquisition {} ended {}: {}", task.getKey(), result.status(), result.error());
            }
            return result;
        } catch (Exception e) {
            logger.error("Acquisition {} failed unexpectedly", task.getKey(), e);
            task.fail(List.of(), e.getMessage());
            return new AcquisitionResult(task.getKey(), AcquisitionResult.Status.ERROR,
                    task.getRequest().entry(), List.of(), e.getMessage());
        } finally {
            registry.retire(task);
        }
    }

    private void dispatch(AcquisitionTask task) {
        try {
            taskExecutor.execute(() -> runTask(task));
        } catch (TaskRejectedException tre) {
            logger.warn("Acquisition executor saturated; running {} inline.", task.getKey());
            runTask(task);
        }
    }
}
