package com.sessionhub.ingestion.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AcquisitionResult;
import com.sessionhub.ingestion.model.AcquisitionTask;
import com.sessionhub.ingestion.service.acquisition.AcquisitionScheduler;
import com.sessionhub.ingestion.service.acquisition.AcquisitionTaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consumes queued acquisition requests. A request whose key is already in flight is deferred by
 * extending the message's visibility; resolved and exhausted requests are deleted, anything else
 * is left for redelivery.
 */
@Service
@ConditionalOnProperty(name = "app.acquisition.dispatch-mode", havingValue = "sqs")
public class AcquisitionQueueListener {

    private static final Logger logger = LoggerFactory.getLogger(AcquisitionQueueListener.class);
    private static final int[] DEFERRAL_SCHEDULE_SECONDS = {30, 60, 120, 240, 300};

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final AcquisitionTaskRegistry registry;
    private final AcquisitionScheduler scheduler;
    private final TaskExecutor taskExecutor;

    @Value("${aws.sqs.queue.url}")
    private String queueUrl;

    @Value("${aws.sqs.listener.batch-size:5}")
    private int batchSize;

    @Value("${aws.sqs.listener.visibility-timeout-seconds:900}")
    private int visibilityTimeoutSeconds;

    public AcquisitionQueueListener(SqsClient sqsClient,
                                    ObjectMapper objectMapper,
                                    AcquisitionTaskRegistry registry,
                                    AcquisitionScheduler scheduler,
                                    @Qualifier("acquisitionExecutor") TaskExecutor taskExecutor) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.scheduler = scheduler;
        this.taskExecutor = taskExecutor;
    }

    @Scheduled(fixedDelayString = "${aws.sqs.listener.poll-delay-ms:2000}")
    public void pollQueue() {
        try {
            if (isWorkerSaturated()) {
                logger.debug("Acquisition pool saturated; skipping this poll.");
                return;
            }
            int batch = Math.max(1, Math.min(batchSize, 10));
            ReceiveMessageRequest receiveMessageRequest = ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(batch)
                    .waitTimeSeconds(20)
                    .visibilityTimeout(visibilityTimeoutSeconds)
                    .attributeNamesWithStrings("ApproximateReceiveCount")
                    .build();

            List<Message> messages = sqsClient.receiveMessage(receiveMessageRequest).messages();
            logger.debug("Polled SQS and received {} acquisition messages.", messages.size());
            for (Message message : messages) {
                handleMessage(message);
            }
        } catch (Exception e) {
            logger.error("Error polling acquisition queue", e);
        }
    }

    void handleMessage(Message message) {
        AcquisitionRequest request;
        try {
            request = objectMapper.readValue(message.body(), AcquisitionRequest.class);
        } catch (Exception e) {
            logger.error("Dropping unreadable acquisition message {}: {}", message.messageId(), e.getMessage(), e);
            deleteMessage(message);
            return;
        }

        Optional<AcquisitionTask> task = registry.register(request);
        if (task.isEmpty()) {
            deferMessage(message);
            return;
        }
        try {
            taskExecutor.execute(() -> process(task.get(), message));
        } catch (TaskRejectedException tre) {
            logger.warn("Executor saturated; processing acquisition message {} inline.", message.messageId());
            process(task.get(), message);
        }
    }

    private void process(AcquisitionTask task, Message message) {
        AcquisitionResult result = scheduler.runTask(task);
        switch (result.status()) {
            case RESOLVED:
            case EXHAUSTED:
                deleteMessage(message);
                break;
            default:
                logger.warn("Acquisition {} ended {}; leaving message {} for redelivery",
                        task.getKey(), result.status(), message.messageId());
        }
    }

    private void deferMessage(Message message) {
        int delaySec = computeDeferralSeconds(message);
        try {
            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .visibilityTimeout(delaySec)
                    .build());
            logger.info("Key already in flight; deferred message {} by {}s.", message.messageId(), delaySec);
        } catch (Exception e) {
            logger.error("Failed to change visibility for message {}: {}", message.messageId(), e.getMessage(), e);
        }
    }

    int computeDeferralSeconds(Message message) {
        Map<String, String> attrs = message.attributesAsStrings();
        String receiveCountStr = attrs != null ? attrs.get("ApproximateReceiveCount") : null;
        int receiveCount = 1;
        if (receiveCountStr != null) {
            try {
                receiveCount = Math.max(1, Integer.parseInt(receiveCountStr));
            } catch (NumberFormatException e) {
                logger.debug("Unparseable receive count '{}' on message {}", receiveCountStr, message.messageId());
            }
        }
        int idx = Math.min(receiveCount - 1, DEFERRAL_SCHEDULE_SECONDS.length - 1);
        return DEFERRAL_SCHEDULE_SECONDS[idx];
    }

    private boolean isWorkerSaturated() {
        if (taskExecutor instanceof ThreadPoolTaskExecutor ex) {
            boolean poolFull = ex.getActiveCount() >= ex.getMaxPoolSize();
            boolean queueFull = ex.getThreadPoolExecutor().getQueue().remainingCapacity() <= 0;
            return poolFull && queueFull;
        }
        return false;
    }

    private void deleteMessage(Message message) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .build());
            logger.debug("Deleted acquisition message {}.", message.messageId());
        } catch (Exception e) {
            logger.error("Failed to delete message {} from SQS queue: {}", message.messageId(), e.getMessage(), e);
        }
    }
}
