package com.loanorigination.repository;

import com.loanorigination.model.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Unpublished events, oldest first. The page bounds one publisher batch.
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.published = false ORDER BY e.createdAt ASC, e.id ASC")
    List<OutboxEvent> findUnpublishedEvents(Pageable page);

    /**
     * Unpublished events older than {@code before}, for stuck-event alerting.
     */
    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    long countByPublishedFalse();

    List<OutboxEvent> findByAggregateIdOrderByIdAsc(String aggregateId);

    /**
     * Published events older than {@code before}, for cleanup.
     */
    List<OutboxEvent> findByPublishedTrueAndPublishedAtBefore(Instant before);
}
