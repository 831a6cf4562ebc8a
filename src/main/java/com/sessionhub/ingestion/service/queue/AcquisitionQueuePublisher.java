package com.sessionhub.ingestion.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * Publishes acquisition requests to SQS when the queue dispatch mode is enabled.
 */
@Service
@ConditionalOnProperty(name = "app.acquisition.dispatch-mode", havingValue = "sqs")
public class AcquisitionQueuePublisher {

    private static final Logger logger = LoggerFactory.getLogger(AcquisitionQueuePublisher.class);

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final String queueUrl;

    /**
     * Creates a publisher bound to the configured queue URL.
     */
    public AcquisitionQueuePublisher(SqsClient sqsClient,
                                     ObjectMapper objectMapper,
                                     @Value("${aws.sqs.queue.url}") String queueUrl) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueUrl = queueUrl;
    }

    /**
     * Sends one request. Failures are logged; the entry stays pending on its record.
     */
    public void publish(AcquisitionRequest request) {
        try {
            String body = objectMapper.writeValueAsString(request);
            sqsClient.sendMessage(SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(body)
                    .build());
            logger.info("Queued acquisition {}", request.key());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing acquisition request {}", request.key(), e);
        } catch (SdkException e) {
            logger.error("Error sending acquisition request {} to SQS", request.key(), e);
        }
    }
}
