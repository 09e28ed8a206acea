package com.loanorigination.producer;

import com.loanorigination.config.KafkaTopics;
import com.loanorigination.event.AuditEvent;
import com.loanorigination.event.QualityCheckCompleted;
import com.loanorigination.event.WorkflowTransitioned;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Sends outbound events to Kafka.
 *
 * All events are keyed by application id, so the events of one application
 * keep their order on a single partition.
 *
 * Sends are asynchronous. Callers that must not lose an event (the outbox
 * publisher) wait on the returned future before recording success.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publishWorkflowTransitioned(
            WorkflowTransitioned event) {

        log.info("Publishing WorkflowTransitioned event: {} ({} -> {})",
                event.applicationId(), event.fromStage(), event.toStage());
        return send(KafkaTopics.WORKFLOW_TRANSITIONED, event.applicationId(), event, event.eventId());
    }

    public CompletableFuture<SendResult<String, Object>> publishAuditEvent(AuditEvent event) {
        log.debug("Publishing AuditEvent: {} by {}", event.action(), event.actor());
        // Audit entries without an application still need a stable key
        String key = event.applicationId() != null ? event.applicationId() : event.action();
        return send(KafkaTopics.AUDIT_EVENTS, key, event, event.eventId());
    }

    public CompletableFuture<SendResult<String, Object>> publishQualityCheckCompleted(
            QualityCheckCompleted event) {

        log.info("Publishing QualityCheckCompleted event: {} ({})",
                event.applicationId(), event.overallStatus());
        return send(KafkaTopics.QUALITY_CHECK_COMPLETED, event.applicationId(), event, event.eventId());
    }

    private CompletableFuture<SendResult<String, Object>> send(
            String topic, String key, Object event, String eventId) {

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish event {} to {}", eventId, topic, ex);
            } else {
                log.debug("Published event {} to {} partition {}",
                        eventId, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
