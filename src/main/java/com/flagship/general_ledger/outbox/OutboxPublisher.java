package com.flagship.general_ledger.outbox;

import com.flagship.general_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * - Key is the aggregate id, so events of one entry or document land on one partition in order
 * - Each send is awaited before the row is marked published (at-least-once)
 * - A failing event stops the batch so later events of the same aggregate are not sent ahead of it
 * - Events past outbox.publisher.max-retries are left for manual intervention
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event_type";
    static final String AGGREGATE_TYPE_HEADER = "aggregate_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(batchSize);
        } catch (Exception e) {
            log.error("Error reading the outbox", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            if (!publishEvent(event)) {
                break;
            }
        }
    }

    /**
     * Publishes immediately instead of waiting for the next poll.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private boolean publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            ledgerEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers()
            .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8))
            .add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            boolean exhausted = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (exhausted) {
                log.warn("Event {} exceeded max retries and needs manual intervention. eventType={}, aggregateId={}",
                    event.getId(), event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return false;
        }
    }
}
