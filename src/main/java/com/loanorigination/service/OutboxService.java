package com.loanorigination.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanorigination.model.OutboxEvent;
import com.loanorigination.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes events to the outbox table inside the caller's transaction.
 *
 * The event commits together with the state change it describes, or not at
 * all. {@link OutboxEventPublisher} moves it to Kafka afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param eventId     unique id, also carried inside {@code event}
     * @param aggregateId application id, used as the Kafka key
     * @param topic       destination topic
     * @param event       event record, stored as JSON; its simple class name is the event type
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent enqueue(String eventId, String aggregateId, String topic, Object event) {
        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setAggregateId(aggregateId);
        outboxEvent.setEventType(event.getClass().getSimpleName());
        outboxEvent.setTopic(topic);
        outboxEvent.setPayload(toJson(event));
        outboxEvent.setPublished(false);
        outboxEvent.setCreatedAt(Instant.now(clock));
        outboxEvent.setRetryCount(0);

        OutboxEvent saved = outboxEventRepository.save(outboxEvent);
        log.debug("Saved {} to outbox: {}", saved.getEventType(), eventId);
        return saved;
    }

    private String toJson(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.getClass().getSimpleName(), e);
        }
    }
}
