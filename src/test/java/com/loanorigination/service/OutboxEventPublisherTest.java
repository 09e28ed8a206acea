package com.loanorigination.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.loanorigination.event.AuditEvent;
import com.loanorigination.event.WorkflowTransitioned;
import com.loanorigination.model.OutboxEvent;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.TriggerType;
import com.loanorigination.model.WorkflowType;
import com.loanorigination.producer.EventProducer;
import com.loanorigination.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxEventPublisherTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private EventProducer eventProducer;

    private ObjectMapper objectMapper;
    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        publisher = new OutboxEventPublisher(outboxEventRepository, eventProducer, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private OutboxEvent outboxEvent(String eventType, Object payload) throws Exception {
        OutboxEvent event = new OutboxEvent();
        event.setId(1L);
        event.setEventId("evt-1");
        event.setAggregateId("APP-1");
        event.setEventType(eventType);
        event.setTopic("loan.workflow.transitioned");
        event.setPayload(objectMapper.writeValueAsString(payload));
        event.setCreatedAt(NOW.minusSeconds(1));
        return event;
    }

    private static WorkflowTransitioned transitioned() {
        return new WorkflowTransitioned("evt-1", "APP-1", "LOS-20250115-1a2b3c4d",
                Stage.PRE_QUALIFICATION, Stage.APPLICATION_PROCESSING, StageStatus.PENDING, StageStatus.PENDING,
                WorkflowType.AUTOMATED, TriggerType.AUTOMATIC, "system", null, NOW);
    }

    private static CompletableFuture<SendResult<String, Object>> acknowledged() {
        return CompletableFuture.completedFuture(null);
    }

    @Test
    @DisplayName("An acknowledged send marks the event published")
    void publishesAndMarks() throws Exception {
        // Given
        OutboxEvent event = outboxEvent("WorkflowTransitioned", transitioned());
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(event));
        when(eventProducer.publishWorkflowTransitioned(any())).thenReturn(acknowledged());

        // When
        publisher.publishEvents();

        // Then
        ArgumentCaptor<WorkflowTransitioned> sent = ArgumentCaptor.forClass(WorkflowTransitioned.class);
        verify(eventProducer).publishWorkflowTransitioned(sent.capture());
        assertThat(sent.getValue()).isEqualTo(transitioned());
        assertThat(event.getPublished()).isTrue();
        assertThat(event.getPublishedAt()).isEqualTo(NOW);
        verify(outboxEventRepository).save(event);
    }

    @Test
    @DisplayName("Audit events are routed to the audit publisher")
    void routesAuditEvents() throws Exception {
        AuditEvent audit = new AuditEvent("evt-1", "APP-1", "STAGE_TRANSITION", "officer.rao",
                Map.of("toStage", "UNDERWRITING"), NOW);
        OutboxEvent event = outboxEvent("AuditEvent", audit);
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(event));
        when(eventProducer.publishAuditEvent(any())).thenReturn(acknowledged());

        publisher.publishEvents();

        verify(eventProducer).publishAuditEvent(audit);
        assertThat(event.getPublished()).isTrue();
    }

    @Test
    @DisplayName("A failed send leaves the event unpublished and counts the attempt")
    void failedSendIsRetriedLater() throws Exception {
        // Given
        OutboxEvent event = outboxEvent("WorkflowTransitioned", transitioned());
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(event));
        when(eventProducer.publishWorkflowTransitioned(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        // When
        publisher.publishEvents();

        // Then
        assertThat(event.getPublished()).isFalse();
        assertThat(event.getPublishedAt()).isNull();
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getLastError()).contains("broker unavailable");
        verify(outboxEventRepository).save(event);
    }

    @Test
    @DisplayName("Unknown event types are recorded as failures without sending")
    void unknownEventType() throws Exception {
        OutboxEvent event = outboxEvent("LegacyEvent", Map.of("a", 1));
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(event));

        publisher.publishEvents();

        verifyNoInteractions(eventProducer);
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getLastError()).isEqualTo("Unknown event type: LegacyEvent");
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of());

        publisher.publishEvents();

        verifyNoInteractions(eventProducer);
        verify(outboxEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Published events older than the retention period are purged")
    void purgesOldPublishedEvents() throws Exception {
        OutboxEvent old = outboxEvent("WorkflowTransitioned", transitioned());
        Instant cutoff = NOW.minus(OutboxEventPublisher.PUBLISHED_RETENTION);
        when(outboxEventRepository.findByPublishedTrueAndPublishedAtBefore(cutoff)).thenReturn(List.of(old));

        publisher.purgePublishedEvents();

        verify(outboxEventRepository).deleteAll(List.of(old));
    }

    @Test
    @DisplayName("An interrupt while waiting for the broker stops the batch and keeps the interrupt flag")
    void interruptStopsBatch() throws Exception {
        // Given
        OutboxEvent first = outboxEvent("WorkflowTransitioned", transitioned());
        OutboxEvent second = outboxEvent("WorkflowTransitioned", transitioned());
        second.setId(2L);
        second.setEventId("evt-2");
        when(outboxEventRepository.findUnpublishedEvents(any(Pageable.class))).thenReturn(List.of(first, second));
        when(eventProducer.publishWorkflowTransitioned(any())).thenReturn(new CompletableFuture<>());

        // When
        Thread.currentThread().interrupt();
        boolean stillInterrupted;
        try {
            publisher.publishEvents();
        } finally {
            stillInterrupted = Thread.interrupted();
        }

        // Then
        assertThat(stillInterrupted).isTrue();
        verify(eventProducer, times(1)).publishWorkflowTransitioned(any());
        assertThat(first.getPublished()).isFalse();
        assertThat(first.getRetryCount()).isZero();
        assertThat(second.getRetryCount()).isZero();
        verify(outboxEventRepository, never()).save(any());
    }
}
