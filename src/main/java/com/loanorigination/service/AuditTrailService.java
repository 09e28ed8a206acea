package com.loanorigination.service;

import com.loanorigination.config.KafkaTopics;
import com.loanorigination.event.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit sink: structured {@code (action, actor, details, timestamp)} entries,
 * written to the outbox in the caller's transaction and published to
 * {@value KafkaTopics#AUDIT_EVENTS}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(String applicationId, String action, String actor, Map<String, Object> details) {
        AuditEvent event = new AuditEvent(
                UUID.randomUUID().toString(),
                applicationId,
                action,
                actor,
                details,
                Instant.now(clock));

        outboxService.enqueue(event.eventId(), applicationId != null ? applicationId : action,
                KafkaTopics.AUDIT_EVENTS, event);

        log.info("Audit: {} by {} on {}", action, event.actor(), applicationId);
        return event;
    }
}
