package com.loanorigination.consumer;

import com.loanorigination.config.KafkaTopics;
import com.loanorigination.event.StageDecisionSubmitted;
import com.loanorigination.exception.TransitionConflictException;
import com.loanorigination.service.IdempotencyService;
import com.loanorigination.service.TransitionResult;
import com.loanorigination.service.WorkflowStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Applies stage decisions submitted by the phase controllers.
 *
 * IDEMPOTENCY:
 * ============
 * Each event is claimed in Redis by its eventId before processing. A
 * redelivered event that was already applied is skipped.
 *
 * FAILURE HANDLING:
 * =================
 * - Transition applied by someone else already (same stage and status):
 *   logged and skipped, nothing to retry
 * - Any other failure: the claim is released and the exception rethrown, so
 *   the container's error handler redelivers the record
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StageDecisionConsumer {

    static final String EVENT_TYPE = "StageDecisionSubmitted";
    static final String CONSUMER_NAME = "StageDecisionConsumer";

    private final IdempotencyService idempotencyService;
    private final WorkflowStateMachine workflowStateMachine;

    @KafkaListener(
            topics = KafkaTopics.STAGE_DECISIONS,
            groupId = "${loan.kafka.consumer-group:loan-origination-engine}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onStageDecision(StageDecisionSubmitted event) {
        log.info("Received StageDecisionSubmitted {} for application {}: {} ({})",
                event.eventId(), event.applicationId(), event.stage(), event.status());

        if (!idempotencyService.tryAcquire(EVENT_TYPE, event.eventId(), CONSUMER_NAME)) {
            log.warn("Event already processed, skipping: {}", event.eventId());
            return;
        }

        try {
            TransitionResult result = workflowStateMachine.transitionToNextStage(
                    event.applicationId(), event.stage(), event.status(), event.decision(), event.triggeredBy());
            log.info("Applied stage decision {}: {} -> {}", event.eventId(), result.fromStage(), result.toStage());

        } catch (TransitionConflictException e) {
            if (e.getCause() == null) {
                // Target stage and status already reached
                log.warn("Stage decision {} already applied to {}: {}",
                        event.eventId(), event.applicationId(), e.getMessage());
                return;
            }
            idempotencyService.release(EVENT_TYPE, event.eventId());
            throw e;

        } catch (RuntimeException e) {
            log.error("Failed to apply stage decision {} for application {}",
                    event.eventId(), event.applicationId(), e);
            idempotencyService.release(EVENT_TYPE, event.eventId());
            throw e;
        }
    }
}
