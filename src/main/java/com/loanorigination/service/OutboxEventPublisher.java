package com.loanorigination.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanorigination.event.AuditEvent;
import com.loanorigination.event.QualityCheckCompleted;
import com.loanorigination.event.WorkflowTransitioned;
import com.loanorigination.model.OutboxEvent;
import com.loanorigination.producer.EventProducer;
import com.loanorigination.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Drains the outbox table to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Every 100ms, fetch up to 100 unpublished events, oldest first
 * 2. For each event: deserialize the payload, send it, wait for the broker
 *    acknowledgement, then mark the row published
 * 3. A failed send increments the retry count and records the error; the
 *    row is picked up again on the next poll
 *
 * An event is marked published only after Kafka acknowledged it, so a
 * broker outage delays events but never drops them. Delivery is
 * at-least-once; consumers deduplicate on {@code eventId}.
 *
 * MONITORING:
 * -----------
 * - error log once an event has failed 10 times
 * - error log for events unpublished for more than 5 minutes
 * - warning when more than 1000 events are queued
 *
 * Published rows are purged after 7 days.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    static final int BATCH_SIZE = 100;
    static final int MAX_RETRY_COUNT = 10;
    static final long SEND_TIMEOUT_SECONDS = 10;
    static final Duration STUCK_THRESHOLD = Duration.ofMinutes(5);
    static final long QUEUE_SIZE_WARNING = 1000;
    static final Duration PUBLISHED_RETENTION = Duration.ofDays(7);

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${loan.outbox.poll-interval-ms:100}")
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEvents(PageRequest.of(0, BATCH_SIZE));

            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());

            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Outbox publishing interrupted at event {}; remaining events wait for the next run",
                             event.getEventId());
                    return;
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    private void publishEvent(OutboxEvent outboxEvent) throws Exception {
        log.debug("Publishing event: {} (type: {})", outboxEvent.getEventId(), outboxEvent.getEventType());

        CompletableFuture<SendResult<String, Object>> future = switch (outboxEvent.getEventType()) {
            case "WorkflowTransitioned" -> eventProducer.publishWorkflowTransitioned(
                    objectMapper.readValue(outboxEvent.getPayload(), WorkflowTransitioned.class));
            case "AuditEvent" -> eventProducer.publishAuditEvent(
                    objectMapper.readValue(outboxEvent.getPayload(), AuditEvent.class));
            case "QualityCheckCompleted" -> eventProducer.publishQualityCheckCompleted(
                    objectMapper.readValue(outboxEvent.getPayload(), QualityCheckCompleted.class));
            default -> throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        };

        future.get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now(clock));
        outboxEventRepository.save(outboxEvent);

        log.debug("Published event: {} (type: {})", outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now(clock).minus(STUCK_THRESHOLD);
            List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} stuck events older than {} minutes",
                          stuckEvents.size(), STUCK_THRESHOLD.toMinutes());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, eventId={}, eventType={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventId(), event.getEventType(),
                              event.getCreatedAt(), event.getRetryCount(), event.getLastError())
                );
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > QUEUE_SIZE_WARNING) {
                log.warn("Outbox queue size is {}", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }

        } catch (Exception e) {
            log.error("Error monitoring stuck events", e);
        }
    }

    /**
     * Deletes events that were published more than 7 days ago.
     */
    @Scheduled(cron = "${loan.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public void purgePublishedEvents() {
        Instant cutoff = Instant.now(clock).minus(PUBLISHED_RETENTION);
        List<OutboxEvent> published = outboxEventRepository.findByPublishedTrueAndPublishedAtBefore(cutoff);
        if (!published.isEmpty()) {
            outboxEventRepository.deleteAll(published);
            log.info("Purged {} published outbox events older than {}", published.size(), cutoff);
        }
    }
}
