package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event waiting to be published to Kafka.
 *
 * Written in the same transaction as the state change it describes, so an
 * event exists if and only if the change committed. OutboxEventPublisher
 * drains the table.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_outbox_published", columnList = "published"),
           @Index(name = "idx_outbox_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Unique id of this event, carried in the payload for consumer-side deduplication
     */
    @Column(nullable = false, unique = true)
    private String eventId;

    /**
     * Application the event is about. Used as the Kafka message key so all
     * events of one application land on one partition, in order.
     */
    @Column(nullable = false)
    private String aggregateId;

    /**
     * e.g. "WorkflowTransitioned", "AuditEvent", "QualityCheckCompleted"
     */
    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    /**
     * Failed publish attempts, for alerting on stuck events
     */
    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
