package com.sessionhub.ingestion.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.SlotType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AcquisitionQueuePublisherTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789012/asset-acquisition";

    @Mock
    private SqsClient sqsClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void publishedBodyReadsBackAsTheSameRequest() throws Exception {
        AcquisitionRequest request = new AcquisitionRequest(UUID.randomUUID(), SlotType.RECAP_DECK,
                AssetEntry.builder().slotType(SlotType.RECAP_DECK).externalId("RECAP1")
                        .exportUrl("https://docs.google.com/presentation/d/RECAP1/export/pptx").build());

        new AcquisitionQueuePublisher(sqsClient, objectMapper, QUEUE_URL).publish(request);

        ArgumentCaptor<SendMessageRequest> sent = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(sent.capture());
        assertThat(sent.getValue().queueUrl()).isEqualTo(QUEUE_URL);
        assertThat(sent.getValue().messageBody()).contains("\"recap_slides\"").doesNotContain("\"key\"");
        assertThat(objectMapper.readValue(sent.getValue().messageBody(), AcquisitionRequest.class)).isEqualTo(request);
    }

    @Test
    void sendFailureIsLoggedNotThrown() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenThrow(SqsException.builder().message("throttled").statusCode(400).build());
        AcquisitionRequest request = new AcquisitionRequest(UUID.randomUUID(), SlotType.PRIMARY_DECK,
                AssetEntry.builder().slotType(SlotType.PRIMARY_DECK).build());

        assertThatCode(() -> new AcquisitionQueuePublisher(sqsClient, objectMapper, QUEUE_URL).publish(request))
                .doesNotThrowAnyException();
    }
}
