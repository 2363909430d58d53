package com.flagship.job_ledger.outbox;

import com.flagship.job_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "job-ledger-events";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "jobLedgerTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private OutboxEvent pending(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Variation", UUID.randomUUID(), "VariationDecided",
                "{\"decision\":\"APPROVE\"}", Instant.now(), null, retryCount, null);
    }

    private CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.getAggregateId().toString(),
                event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Events are sent keyed by aggregate id and then marked published")
    void publishesKeyedByAggregate() {
        OutboxEvent event = pending(0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(sent(event));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("VariationDecided");
    }

    @Test
    @DisplayName("A failed send is recorded against the event and retried later")
    void failedSendMarksFailed() {
        OutboxEvent event = pending(1);
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString())).thenReturn(failed);

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("VariationDecided");
    }

    @Test
    @DisplayName("Events past the retry limit stay behind as dead letters")
    void deadLetterNotSent() {
        OutboxEvent event = pending(3);

        publisher.publishEvent(event);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(outboxMetrics).recordEventDeadLettered("VariationDecided");
    }

    @Test
    @DisplayName("A polling failure does not escape the scheduler")
    void pollingFailureContained() {
        when(outboxService.findUnpublishedEvents(100)).thenThrow(new IllegalStateException("db down"));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
