package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Work item for an employee reviewing one stage of one application.
 * At most one task exists per application and stage; re-entering a stage
 * reopens it.
 */
@Entity
@Table(name = "manual_review_tasks",
       uniqueConstraints = @UniqueConstraint(name = "uk_review_task_stage",
               columnNames = {"applicationId", "stage"}),
       indexes = @Index(name = "idx_review_task_status", columnList = "status"))
@Data
@NoArgsConstructor
public class ManualReviewTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String applicationId;

    @Column(nullable = false)
    private String applicationNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewType reviewType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewTaskStatus status;

    private String assignedTo;

    @Column(nullable = false)
    private Instant dueAt;

    @Column(nullable = false)
    private Instant createdAt;
}
